package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Thrown when a drop folder (local, FTP or SFTP) cannot be listed, read or written after retries.
 */
public class SourceAccessException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 7712093346650213870L;

    public SourceAccessException(String message) {
        super(message);
    }

    public SourceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
