package com.eyelevel.invoiceingestion.service.notification;

public enum DeliveryErrorType {
    PERMANENT(false),
    TEMPORARY(true),
    RATE_LIMITED(true),
    UNKNOWN(true);

    private final boolean retryable;

    DeliveryErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
