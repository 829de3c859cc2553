package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.repository.QueueJobRepository;
import com.eyelevel.invoiceingestion.service.queue.event.JobEventType;
import com.eyelevel.invoiceingestion.service.queue.event.JobLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Recovers ACTIVE jobs whose lock expired without renewal. A stalled job goes back to WAITING without the
 * stalled attempt being counted, up to the queue's {@code maxStalledCount}; beyond that it fails and is
 * dead-lettered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StalledJobMonitor {

    static final String STALLED_TOO_OFTEN = "job stalled more than allowable limit";

    private final QueueJobRepository queueJobRepository;
    private final QueuePolicies queuePolicies;
    private final DeadLetterService deadLetterService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return the number of stalled jobs handled
     */
    @Transactional
    public int checkStalled(final QueueName queue) {
        final QueuePolicy policy = queuePolicies.policy(queue);
        final List<QueueJob> stalled = queueJobRepository.findStalled(queue.getQueueName(), LocalDateTime.now(),
                                                                      JobStatus.ACTIVE);
        if (stalled.isEmpty()) {
            return 0;
        }
        log.warn("[Queue: {}] Found {} stalled job(s).", queue.getQueueName(), stalled.size());

        int handled = 0;
        for (QueueJob job : stalled) {
            try {
                if (job.getStalledCount() + 1 <= policy.maxStalledCount()) {
                    if (queueJobRepository.requeueStalled(job.getId(), job.getLockToken(), JobStatus.WAITING,
                                                          JobStatus.ACTIVE) == 1) {
                        handled++;
                        eventPublisher.publishEvent(JobLifecycleEvent.of(
                                queue.getQueueName(), job.getId(), job.getJobName(), JobEventType.STALLED,
                                job.getAttemptsMade() - 1, "requeued (stall " + (job.getStalledCount() + 1) + " of "
                                                           + policy.maxStalledCount() + ")"));
                    }
                } else if (queueJobRepository.failStalled(job.getId(), job.getLockToken(), STALLED_TOO_OFTEN,
                                                          LocalDateTime.now(), JobStatus.FAILED,
                                                          JobStatus.ACTIVE) == 1) {
                    handled++;
                    deadLetterService.record(job, job.getMaxAttempts(), STALLED_TOO_OFTEN, null);
                    eventPublisher.publishEvent(JobLifecycleEvent.of(
                            queue.getQueueName(), job.getId(), job.getJobName(), JobEventType.DEAD_LETTERED,
                            job.getMaxAttempts(), STALLED_TOO_OFTEN));
                }
            } catch (Exception e) {
                log.error("[Queue: {}, JobId: {}] Failed to recover stalled job.", queue.getQueueName(), job.getId(), e);
            }
        }
        return handled;
    }
}
