package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.common.json.JsonParser;
import com.eyelevel.invoiceingestion.common.json.JsonSerializer;
import com.eyelevel.invoiceingestion.exception.JobPayloadException;
import com.eyelevel.invoiceingestion.exception.JobProcessingFailedException;
import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import com.eyelevel.invoiceingestion.exception.json.JsonParsingException;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.service.queue.event.JobEventType;
import com.eyelevel.invoiceingestion.service.queue.event.JobLifecycleEvent;
import com.eyelevel.invoiceingestion.service.queue.payload.JobPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Consumes one queue. A dedicated polling thread claims ready jobs while a concurrency permit is free and hands
 * them to a bounded executor. While a handler runs its lock is renewed every half lock duration; a job whose
 * renewals stop (crashed or frozen worker) is picked up by stall detection.
 */
@Slf4j
public class QueueWorker {

    private final QueuePolicy policy;
    private final JobHandler<?> handler;
    private final Collaborators collaborators;
    private final Duration pollInterval;
    private final Semaphore permits;

    private ThreadPoolTaskExecutor executor;
    private Thread poller;
    private volatile boolean running;
    private volatile long lastPromotion;

    /**
     * The shared services every worker needs.
     */
    public record Collaborators(JobLockService lockService,
                                DeadLetterService deadLetterService,
                                ImportBatchService importBatchService,
                                JsonParser jsonParser,
                                JsonSerializer jsonSerializer,
                                Validator validator,
                                TaskScheduler taskScheduler,
                                ApplicationEventPublisher eventPublisher) {
    }

    public QueueWorker(QueuePolicy policy, JobHandler<?> handler, Collaborators collaborators, Duration pollInterval) {
        this.policy = policy;
        this.handler = handler;
        this.collaborators = collaborators;
        this.pollInterval = pollInterval;
        this.permits = new Semaphore(policy.concurrency());
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(policy.concurrency());
        executor.setMaxPoolSize(policy.concurrency());
        executor.setQueueCapacity(policy.concurrency());
        executor.setThreadNamePrefix(queueName() + "-worker-");
        executor.initialize();

        running = true;
        poller = new Thread(this::pollLoop, queueName() + "-poller");
        poller.setDaemon(true);
        poller.start();
        log.info("[Queue: {}] Worker started with concurrency {}, lock {} ms, {} attempt(s).", queueName(),
                 policy.concurrency(), policy.lockDuration().toMillis(), policy.attempts());
    }

    /**
     * Stops claiming new jobs. Jobs already running continue until {@link #awaitIdle(Duration)} or
     * {@link #shutdownExecutor()}.
     */
    public synchronized void stopPolling() {
        running = false;
        if (poller != null) {
            poller.interrupt();
        }
    }

    /**
     * @return {@code true} if every in-flight job finished within the timeout
     */
    public boolean awaitIdle(final Duration timeout) throws InterruptedException {
        if (permits.tryAcquire(policy.concurrency(), timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            permits.release(policy.concurrency());
            return true;
        }
        return false;
    }

    public synchronized void shutdownExecutor() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int inFlight() {
        return policy.concurrency() - permits.availablePermits();
    }

    public QueuePolicy getPolicy() {
        return policy;
    }

    private void pollLoop() {
        while (running) {
            boolean permitHeld = false;
            try {
                permits.acquire();
                permitHeld = true;
                if (!running) {
                    break;
                }
                promoteDelayedIfDue();
                final Optional<QueueJob> claimed = collaborators.lockService().claimNext(policy);
                if (claimed.isEmpty()) {
                    permits.release();
                    permitHeld = false;
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                final QueueJob job = claimed.get();
                executor.execute(() -> {
                    try {
                        process(job);
                    } finally {
                        permits.release();
                    }
                });
                permitHeld = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("[Queue: {}] Polling failed. Retrying after {} ms.", queueName(), pollInterval.toMillis(), e);
                sleepQuietly();
            } finally {
                if (permitHeld) {
                    permits.release();
                }
            }
        }
        log.info("[Queue: {}] Polling loop stopped.", queueName());
    }

    private void promoteDelayedIfDue() {
        final long now = System.currentTimeMillis();
        if (now - lastPromotion < pollInterval.toMillis()) {
            return;
        }
        lastPromotion = now;
        final int promoted = collaborators.lockService().promoteDelayed(policy.queue());
        if (promoted > 0) {
            log.debug("[Queue: {}] Promoted {} delayed job(s) to waiting.", queueName(), promoted);
        }
    }

    void process(final QueueJob job) {
        final Duration renewEvery = policy.lockDuration().dividedBy(2);
        final ScheduledFuture<?> renewal = collaborators.taskScheduler().scheduleAtFixedRate(
                () -> renewLock(job), Instant.now().plus(renewEvery), renewEvery);
        publish(job, JobEventType.STARTED, null);
        try {
            final JobPayload payload = decode(job);
            final JobContext context = new JobContext(job.getId(), policy.queue(), job.getJobName(),
                                                      job.getAttemptsMade(), job.getMaxAttempts(),
                                                      job.getImportBatchId());
            final Object result = invoke(handler, context, payload);
            final String returnValue = result == null ? null : collaborators.jsonSerializer().serialize(result);
            if (collaborators.lockService().complete(job.getId(), job.getLockToken(), returnValue)) {
                publish(job, JobEventType.COMPLETED, null);
            } else {
                publish(job, JobEventType.LOCK_LOST, "Result discarded; the job is no longer owned by this worker.");
            }
        } catch (RuntimeException e) {
            onFailure(job, e);
        } catch (Exception e) {
            onFailure(job, new JobProcessingFailedException(describe(e), e));
        } catch (Error e) {
            // an Error must still leave the job retried or failed
            log.error("[Queue: {}, JobId: {}] Handler raised {}.", queueName(), job.getId(),
                      e.getClass().getSimpleName(), e);
            onFailure(job, new JobProcessingFailedException(describe(e), e));
        } finally {
            renewal.cancel(false);
            completeBatchIfDrained(job);
        }
    }

    private void completeBatchIfDrained(final QueueJob job) {
        if (job.getImportBatchId() == null) {
            return;
        }
        try {
            collaborators.importBatchService().completeIfDrained(job.getImportBatchId());
        } catch (RuntimeException e) {
            log.error("[Queue: {}, JobId: {}] Could not update import batch {}.", queueName(), job.getId(),
                      job.getImportBatchId(), e);
        }
    }

    private void onFailure(final QueueJob job, final Exception error) {
        final String message = describe(error);
        final boolean unrecoverable = isUnrecoverable(error);
        if (!unrecoverable && job.getAttemptsMade() < job.getMaxAttempts()) {
            final LocalDateTime availableAt = LocalDateTime.now().plus(policy.backoffFor(job.getAttemptsMade()));
            if (collaborators.lockService().scheduleRetry(job.getId(), job.getLockToken(), message, availableAt)) {
                publish(job, JobEventType.RETRY_SCHEDULED, message + " (next attempt at " + availableAt + ")");
            } else {
                publish(job, JobEventType.LOCK_LOST, message);
            }
            return;
        }

        if (collaborators.lockService().fail(job.getId(), job.getLockToken(), message)) {
            publish(job, JobEventType.FAILED, message);
            collaborators.deadLetterService().record(job, job.getAttemptsMade(), message, error);
            publish(job, JobEventType.DEAD_LETTERED, message);
        } else {
            publish(job, JobEventType.LOCK_LOST, message);
        }
    }

    private void renewLock(final QueueJob job) {
        try {
            if (!collaborators.lockService().renewLock(job.getId(), job.getLockToken(), policy)) {
                log.warn("[Queue: {}, JobId: {}] Lock renewal rejected. The job was taken over.", queueName(),
                         job.getId());
            }
        } catch (RuntimeException e) {
            log.error("[Queue: {}, JobId: {}] Lock renewal failed.", queueName(), job.getId(), e);
        }
    }

    private JobPayload decode(final QueueJob job) {
        final JobPayload payload;
        try {
            payload = collaborators.jsonParser().parseObject(job.getPayload(), JobPayload.class);
        } catch (JsonParsingException e) {
            throw new JobPayloadException("Unreadable payload for job " + job.getId(), e);
        }
        if (payload == null) {
            throw new JobPayloadException("Empty payload for job " + job.getId());
        }
        final Set<ConstraintViolation<JobPayload>> violations = collaborators.validator().validate(payload);
        if (!violations.isEmpty()) {
            throw new JobPayloadException("Invalid payload for job " + job.getId() + ": "
                                                + violations.stream()
                                                            .map(v -> v.getPropertyPath() + " " + v.getMessage())
                                                            .sorted()
                                                            .collect(Collectors.joining(", ")));
        }
        return payload;
    }

    private static <P extends JobPayload> Object invoke(final JobHandler<P> handler, final JobContext context,
                                                        final JobPayload payload) throws Exception {
        if (!handler.payloadType().isInstance(payload)) {
            throw new JobPayloadException("Queue " + context.queue().getQueueName() + " expects "
                                                + handler.payloadType().getSimpleName() + " but got "
                                                + payload.getClass().getSimpleName());
        }
        return handler.handle(context, handler.payloadType().cast(payload));
    }

    static boolean isUnrecoverable(final Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnrecoverableJobException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(final Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void publish(final QueueJob job, final JobEventType type, final String detail) {
        collaborators.eventPublisher().publishEvent(JobLifecycleEvent.of(queueName(), job.getId(), job.getJobName(),
                                                                         type, job.getAttemptsMade(), detail));
    }

    private String queueName() {
        return policy.queue().getQueueName();
    }

    private void sleepQuietly() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
