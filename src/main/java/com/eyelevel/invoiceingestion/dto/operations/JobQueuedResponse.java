package com.eyelevel.invoiceingestion.dto.operations;

public record JobQueuedResponse(Long jobId, String queueName, String jobName) {
}
