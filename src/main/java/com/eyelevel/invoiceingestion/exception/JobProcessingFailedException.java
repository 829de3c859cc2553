package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Wraps a checked exception thrown by a job handler. The job is retried under its queue's backoff policy.
 */
public class JobProcessingFailedException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public JobProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
