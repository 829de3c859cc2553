package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.common.json.JsonSerializer;
import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.repository.QueueJobRepository;
import com.eyelevel.invoiceingestion.service.queue.event.JobEventType;
import com.eyelevel.invoiceingestion.service.queue.event.JobLifecycleEvent;
import com.eyelevel.invoiceingestion.service.queue.payload.JobPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Producer side of the durable job queues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueService {

    private final QueueJobRepository queueJobRepository;
    private final QueuePolicies queuePolicies;
    private final JsonSerializer jsonSerializer;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public QueueJob enqueue(final QueueName queue, final String jobName, final JobPayload payload) {
        return enqueue(queue, jobName, payload, null);
    }

    /**
     * Persists a WAITING job that becomes visible to workers once the surrounding transaction commits.
     *
     * @param dedupKey identity used by producers to avoid queueing the same work twice, may be {@code null}
     */
    @Transactional
    public QueueJob enqueue(final QueueName queue, final String jobName, final JobPayload payload,
                            final String dedupKey) {
        final QueueJob job = queueJobRepository.save(QueueJob.builder()
                                                             .queueName(queue.getQueueName())
                                                             .jobName(jobName)
                                                             .payload(jsonSerializer.serialize(payload))
                                                             .dedupKey(dedupKey)
                                                             .contentDigest(payload.contentDigest())
                                                             .importBatchId(payload.importBatchId())
                                                             .maxAttempts(queuePolicies.policy(queue).attempts())
                                                             .availableAt(LocalDateTime.now())
                                                             .status(JobStatus.WAITING)
                                                             .build());
        eventPublisher.publishEvent(JobLifecycleEvent.of(queue.getQueueName(), job.getId(), jobName,
                                                         JobEventType.QUEUED, 0, null));
        return job;
    }

    /**
     * @return {@code true} if a job with this dedup key is waiting, running or scheduled for retry
     */
    @Transactional(readOnly = true)
    public boolean isQueued(final QueueName queue, final String dedupKey) {
        return dedupKey != null
               && queueJobRepository.existsByQueueNameAndDedupKeyAndStatusIn(queue.getQueueName(), dedupKey,
                                                                             JobStatus.PENDING);
    }

    /**
     * @return {@code true} if a pending job in the queue already carries a file with this content digest
     */
    @Transactional(readOnly = true)
    public boolean isContentQueued(final QueueName queue, final String contentDigest) {
        return contentDigest != null
               && queueJobRepository.existsByQueueNameAndContentDigestAndStatusIn(queue.getQueueName(),
                                                                                  contentDigest, JobStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public QueueCounts counts(final QueueName queue) {
        final String name = queue.getQueueName();
        return new QueueCounts(name,
                               queueJobRepository.countByQueueNameAndStatus(name, JobStatus.WAITING),
                               queueJobRepository.countByQueueNameAndStatus(name, JobStatus.ACTIVE),
                               queueJobRepository.countByQueueNameAndStatus(name, JobStatus.DELAYED),
                               queueJobRepository.countByQueueNameAndStatus(name, JobStatus.COMPLETED),
                               queueJobRepository.countByQueueNameAndStatus(name, JobStatus.FAILED));
    }
}
