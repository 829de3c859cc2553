package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.repository.QueueJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Deletes finished jobs once they are past their queue retention. The newest completed jobs of each queue are
 * kept regardless of age. Dead-letter records live in their own table and are never touched here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueRetentionService {

    private final QueueJobRepository queueJobRepository;
    private final IngestionProperties properties;

    /**
     * @return the number of jobs deleted over all queues
     */
    @Transactional
    public int sweep() {
        final IngestionProperties.Health health = properties.getHealth();
        final LocalDateTime now = LocalDateTime.now();
        final LocalDateTime completedCutoff = now.minusNanos(health.getCompletedRetentionMs() * 1_000_000L);
        final LocalDateTime failedCutoff = now.minusNanos(health.getFailedRetentionMs() * 1_000_000L);

        int deleted = 0;
        for (QueueName queue : QueueName.values()) {
            final String name = queue.getQueueName();
            List<Long> keep = queueJobRepository.findNewestFinishedIds(name, JobStatus.COMPLETED,
                                                                       PageRequest.of(0, health.getCompletedKeepCount()));
            if (keep.isEmpty()) {
                // "not in ()" is not portable
                keep = List.of(-1L);
            }
            final int completed = queueJobRepository.deleteFinishedBefore(name, JobStatus.COMPLETED, completedCutoff,
                                                                          keep);
            final int failed = queueJobRepository.deleteFinishedBefore(name, JobStatus.FAILED, failedCutoff,
                                                                       List.of(-1L));
            if (completed + failed > 0) {
                log.info("[Queue: {}] Retention removed {} completed and {} failed job(s).", name, completed, failed);
            }
            deleted += completed + failed;
        }
        return deleted;
    }
}
