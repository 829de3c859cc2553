package com.eyelevel.invoiceingestion.service.queue.event;

import java.time.LocalDateTime;

/**
 * One state change of a queued job. Every queue publishes through the same application event channel.
 */
public record JobLifecycleEvent(String queueName,
                                Long jobId,
                                String jobName,
                                JobEventType type,
                                int attemptsMade,
                                String detail,
                                LocalDateTime occurredAt) {

    public static JobLifecycleEvent of(String queueName, Long jobId, String jobName, JobEventType type,
                                       int attemptsMade, String detail) {
        return new JobLifecycleEvent(queueName, jobId, jobName, type, attemptsMade, detail, LocalDateTime.now());
    }
}
