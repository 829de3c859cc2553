package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Thrown when a document cannot be opened or read while applying an extraction template.
 */
public class TemplateExtractionException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 2209841176033420591L;

    public TemplateExtractionException(String message) {
        super(message);
    }

    public TemplateExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
