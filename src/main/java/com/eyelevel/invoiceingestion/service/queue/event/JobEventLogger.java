package com.eyelevel.invoiceingestion.service.queue.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes every job lifecycle event to the log, at a level matching its severity.
 */
@Slf4j
@Component
public class JobEventLogger {

    @EventListener
    public void onJobEvent(final JobLifecycleEvent event) {
        switch (event.type()) {
            case QUEUED, STARTED -> log.debug("[Queue: {}, JobId: {}] {} '{}' (attempt {}).", event.queueName(),
                                              event.jobId(), event.type(), event.jobName(), event.attemptsMade());
            case COMPLETED -> log.info("[Queue: {}, JobId: {}] Job '{}' completed on attempt {}.", event.queueName(),
                                       event.jobId(), event.jobName(), event.attemptsMade());
            case RETRY_SCHEDULED, STALLED, LOCK_LOST -> log.warn("[Queue: {}, JobId: {}] {} for '{}' (attempt {}): {}",
                                                                 event.queueName(), event.jobId(), event.type(),
                                                                 event.jobName(), event.attemptsMade(), event.detail());
            case FAILED, DEAD_LETTERED -> log.error("[Queue: {}, JobId: {}] {} for '{}' after {} attempt(s): {}",
                                                    event.queueName(), event.jobId(), event.type(), event.jobName(),
                                                    event.attemptsMade(), event.detail());
        }
    }
}
