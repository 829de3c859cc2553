package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Signals that a job must not be retried. The worker moves the job straight to the dead-letter queue
 * regardless of how many attempts remain.
 */
public class UnrecoverableJobException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 8830117352948271063L;

    public UnrecoverableJobException(String message) {
        super(message);
    }

    public UnrecoverableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
