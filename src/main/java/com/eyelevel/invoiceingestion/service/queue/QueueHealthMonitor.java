package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.service.queue.event.QueueHealthAlertEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Samples the job counts of every queue and raises a {@link QueueHealthAlertEvent} when the waiting backlog
 * crosses the threshold or the failed count grew by more than the allowed delta since the previous sample.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueHealthMonitor {

    private final JobQueueService jobQueueService;
    private final IngestionProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<QueueName, Long> lastFailed = new ConcurrentHashMap<>();

    /**
     * @return the counts of every queue, in declaration order
     */
    public List<QueueCounts> check() {
        final IngestionProperties.Health health = properties.getHealth();
        final List<QueueCounts> snapshot = new ArrayList<>();
        for (QueueName queue : QueueName.values()) {
            try {
                final QueueCounts counts = jobQueueService.counts(queue);
                snapshot.add(counts);
                evaluate(queue, counts, health);
            } catch (Exception e) {
                log.error("[Queue: {}] Health check failed.", queue.getQueueName(), e);
            }
        }
        return snapshot;
    }

    private void evaluate(final QueueName queue, final QueueCounts counts, final IngestionProperties.Health health) {
        if (counts.waiting() > health.getWaitingAlertThreshold()) {
            alert(queue, counts, "waiting backlog " + counts.waiting() + " exceeds "
                                 + health.getWaitingAlertThreshold());
        }
        final Long previous = lastFailed.put(queue, counts.failed());
        if (previous != null && counts.failed() > previous + health.getFailedAlertDelta()) {
            alert(queue, counts, "failed jobs grew from " + previous + " to " + counts.failed());
        }
        log.debug("[Queue: {}] waiting={}, active={}, delayed={}, failed={}", queue.getQueueName(), counts.waiting(),
                  counts.active(), counts.delayed(), counts.failed());
    }

    private void alert(final QueueName queue, final QueueCounts counts, final String reason) {
        log.error("[Queue: {}] Health alert: {}", queue.getQueueName(), reason);
        eventPublisher.publishEvent(new QueueHealthAlertEvent(queue.getQueueName(), reason, counts,
                                                              LocalDateTime.now()));
    }
}
