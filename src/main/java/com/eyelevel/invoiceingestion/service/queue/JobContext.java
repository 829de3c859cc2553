package com.eyelevel.invoiceingestion.service.queue;

/**
 * What a handler knows about the job it is running.
 *
 * @param attemptsMade attempts including the current one
 */
public record JobContext(Long jobId, QueueName queue, String jobName, int attemptsMade, int maxAttempts,
                         String importBatchId) {
}
