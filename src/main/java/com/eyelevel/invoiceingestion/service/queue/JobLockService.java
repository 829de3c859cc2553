package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.repository.QueueJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional state transitions used by queue workers. Each transition is a conditional update, so two
 * workers can never both own a job and a worker that lost its lock cannot overwrite the job's state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLockService {

    private static final int CLAIM_CANDIDATES = 5;

    private final QueueJobRepository queueJobRepository;

    /**
     * Atomically claims the next ready job of the queue: WAITING to ACTIVE with a fresh lock token and one more
     * attempt counted.
     *
     * @return the claimed job, or empty if nothing is ready or every candidate was taken by another worker
     */
    @Transactional
    public Optional<QueueJob> claimNext(final QueuePolicy policy) {
        final LocalDateTime now = LocalDateTime.now();
        final List<Long> candidates = queueJobRepository.findReadyIds(policy.queue().getQueueName(), JobStatus.WAITING,
                                                                      now, PageRequest.of(0, CLAIM_CANDIDATES));
        for (Long id : candidates) {
            final String token = UUID.randomUUID().toString();
            final int claimed = queueJobRepository.claim(id, token, now.plus(policy.lockDuration()), JobStatus.ACTIVE,
                                                         JobStatus.WAITING);
            if (claimed == 1) {
                return queueJobRepository.findById(id);
            }
            log.trace("Job {} was claimed by another worker.", id);
        }
        return Optional.empty();
    }

    @Transactional
    public boolean renewLock(final Long jobId, final String token, final QueuePolicy policy) {
        return queueJobRepository.renewLock(jobId, token, LocalDateTime.now().plus(policy.lockDuration()),
                                            JobStatus.ACTIVE) == 1;
    }

    @Transactional
    public boolean complete(final Long jobId, final String token, final String returnValue) {
        return queueJobRepository.finish(jobId, token, JobStatus.COMPLETED, returnValue, null, LocalDateTime.now(),
                                         LocalDateTime.now(), JobStatus.ACTIVE) == 1;
    }

    @Transactional
    public boolean scheduleRetry(final Long jobId, final String token, final String error,
                                 final LocalDateTime availableAt) {
        return queueJobRepository.finish(jobId, token, JobStatus.DELAYED, null, error, availableAt, null,
                                         JobStatus.ACTIVE) == 1;
    }

    @Transactional
    public boolean fail(final Long jobId, final String token, final String error) {
        return queueJobRepository.finish(jobId, token, JobStatus.FAILED, null, error, LocalDateTime.now(),
                                         LocalDateTime.now(), JobStatus.ACTIVE) == 1;
    }

    /**
     * Moves DELAYED jobs whose backoff has elapsed back to WAITING.
     */
    @Transactional
    public int promoteDelayed(final QueueName queue) {
        return queueJobRepository.promoteDelayed(queue.getQueueName(), LocalDateTime.now(), JobStatus.DELAYED,
                                                 JobStatus.WAITING);
    }
}
