package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

public class ResourceNotFoundException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -2745521083962190317L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
