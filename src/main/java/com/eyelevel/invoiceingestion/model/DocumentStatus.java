package com.eyelevel.invoiceingestion.model;

/**
 * Lifecycle of an ingested document. {@code PROCESSING} is the only non-terminal state.
 */
public enum DocumentStatus {
    PROCESSING,
    PARSED,
    UNALLOCATED,
    DUPLICATE,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
