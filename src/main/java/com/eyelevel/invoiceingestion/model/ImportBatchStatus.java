package com.eyelevel.invoiceingestion.model;

public enum ImportBatchStatus {
    RUNNING,
    CANCELLED,
    COMPLETED
}
