package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Thrown when a template is saved with malformed regions or cell references.
 */
public class InvalidTemplateException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 1937750406618112264L;

    public InvalidTemplateException(String message) {
        super(message);
    }
}
