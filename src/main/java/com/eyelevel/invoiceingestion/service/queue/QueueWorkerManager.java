package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.common.json.JsonParser;
import com.eyelevel.invoiceingestion.common.json.JsonSerializer;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns one {@link QueueWorker} per queue that has a handler and drives their lifecycle with the application
 * context. On shutdown it stops polling, waits for in-flight jobs up to the longest lock duration, then shuts
 * the executors down. Jobs still ACTIVE after that are recovered by stall detection on the next start.
 */
@Slf4j
@Component
public class QueueWorkerManager implements SmartLifecycle {

    private final JobHandlerRegistry handlerRegistry;
    private final QueuePolicies queuePolicies;
    private final QueueWorker.Collaborators collaborators;
    private final Duration pollInterval;
    private final boolean workersEnabled;
    private final List<QueueWorker> workers = new ArrayList<>();
    private volatile boolean running;

    public QueueWorkerManager(JobHandlerRegistry handlerRegistry,
                              QueuePolicies queuePolicies,
                              JobLockService lockService,
                              DeadLetterService deadLetterService,
                              ImportBatchService importBatchService,
                              JsonParser jsonParser,
                              JsonSerializer jsonSerializer,
                              Validator validator,
                              TaskScheduler taskScheduler,
                              ApplicationEventPublisher eventPublisher,
                              @Value("${app.scheduler.queue-poll-ms:1000}") long pollIntervalMs,
                              @Value("${app.scheduler.workers-enabled:true}") boolean workersEnabled) {
        this.handlerRegistry = handlerRegistry;
        this.queuePolicies = queuePolicies;
        this.collaborators = new QueueWorker.Collaborators(lockService, deadLetterService, importBatchService,
                                                           jsonParser, jsonSerializer, validator, taskScheduler,
                                                           eventPublisher);
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.workersEnabled = workersEnabled;
    }

    @Override
    public synchronized void start() {
        if (!workersEnabled) {
            log.info("Queue workers are disabled. Jobs will be queued but not processed by this instance.");
            running = true;
            return;
        }
        handlerRegistry.getHandlers().forEach((queue, handler) -> {
            final QueueWorker worker = new QueueWorker(queuePolicies.policy(queue), handler, collaborators,
                                                       pollInterval);
            worker.start();
            workers.add(worker);
        });
        running = true;
        log.info("Started {} queue worker(s).", workers.size());
    }

    @Override
    public synchronized void stop() {
        log.info("Graceful shutdown: stopping {} queue worker(s).", workers.size());
        workers.forEach(QueueWorker::stopPolling);

        final Duration grace = workers.stream()
                                      .map(worker -> worker.getPolicy().lockDuration())
                                      .max(Duration::compareTo)
                                      .orElse(Duration.ZERO);
        final long deadline = System.currentTimeMillis() + grace.toMillis();
        for (QueueWorker worker : workers) {
            final long remaining = Math.max(0, deadline - System.currentTimeMillis());
            try {
                if (!worker.awaitIdle(Duration.ofMillis(remaining))) {
                    log.warn("[Queue: {}] {} job(s) still running after the grace period. Stall detection will "
                             + "recover them.", worker.getPolicy().queue().getQueueName(), worker.inFlight());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for in-flight jobs.");
                break;
            }
        }
        workers.forEach(QueueWorker::shutdownExecutor);
        workers.clear();
        running = false;
        log.info("Graceful shutdown complete.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Stop before the scheduler and datasource so that in-flight jobs can still finish their updates.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    public int workerCount() {
        return workers.size();
    }

    public List<QueueWorker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }
}
