package com.eyelevel.invoiceingestion.service.queue.event;

public enum JobEventType {
    QUEUED,
    STARTED,
    COMPLETED,
    RETRY_SCHEDULED,
    FAILED,
    STALLED,
    DEAD_LETTERED,
    LOCK_LOST
}
