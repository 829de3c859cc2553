package com.eyelevel.invoiceingestion.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Raised by a notification sender when a provider rejects or fails a delivery. Carries the provider's
 * transport error code (e.g. {@code ECONNRESET}) and numeric response code when they are known, so the
 * failure can be classified.
 */
@Getter
public class NotificationDeliveryException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 6043378195302311784L;

    private final String errorCode;
    private final Integer responseCode;

    public NotificationDeliveryException(String message, String errorCode, Integer responseCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.responseCode = responseCode;
    }

    public NotificationDeliveryException(String message, String errorCode, Integer responseCode) {
        this(message, errorCode, responseCode, null);
    }
}
