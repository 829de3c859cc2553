package com.eyelevel.invoiceingestion.service.notification;

/**
 * @param code the response code or transport error code the decision was based on, may be {@code null}
 */
public record DeliveryErrorClassification(DeliveryErrorType type, boolean retryable, String code) {

    static DeliveryErrorClassification of(final DeliveryErrorType type, final Object code) {
        return new DeliveryErrorClassification(type, type.isRetryable(), code == null ? null : String.valueOf(code));
    }
}
