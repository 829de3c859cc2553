package com.eyelevel.invoiceingestion.exception.json;

import com.eyelevel.invoiceingestion.exception.IngestionException;

import java.io.Serial;

/**
 * Thrown when a job payload, a job return value or a stored extraction result cannot be read or written as JSON.
 * A queued job whose payload fails to parse is failed without retries.
 */
public class JsonParsingException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -2871644093518270137L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
