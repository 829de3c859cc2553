package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur inside the ingestion pipeline.
 */
public class IngestionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234311L;

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
