package com.eyelevel.invoiceingestion.model;

import java.util.List;

public enum JobStatus {
    WAITING,
    ACTIVE,
    DELAYED,
    COMPLETED,
    FAILED;

    /**
     * States in which a job still counts as queued for duplicate-enqueue checks.
     */
    public static final List<JobStatus> PENDING = List.of(WAITING, ACTIVE, DELAYED);
}
