package com.eyelevel.invoiceingestion.service.routing;

/**
 * Where a file ends up once its processing is settled.
 */
public enum TerminalState {
    PROCESSED,
    DUPLICATE,
    FAILED
}
