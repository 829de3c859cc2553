package com.eyelevel.invoiceingestion.model;

public enum DeliveryStatus {
    PENDING,
    SENDING,
    SENT,
    DEFERRED,
    FAILED_PERMANENT
}
