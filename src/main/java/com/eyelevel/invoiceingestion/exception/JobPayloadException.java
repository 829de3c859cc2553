package com.eyelevel.invoiceingestion.exception;

import java.io.Serial;

/**
 * Thrown when a job payload cannot be deserialized or fails validation at dequeue time. Such a job is
 * failed at once since no retry can fix its payload.
 */
public class JobPayloadException extends UnrecoverableJobException {
    @Serial
    private static final long serialVersionUID = 5518823009174455102L;

    public JobPayloadException(String message) {
        super(message);
    }

    public JobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
