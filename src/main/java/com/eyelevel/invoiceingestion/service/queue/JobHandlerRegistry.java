package com.eyelevel.invoiceingestion.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Indexes every {@link JobHandler} bean by the queue it serves. Exactly one handler per queue is allowed.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<QueueName, JobHandler<?>> handlers = new EnumMap<>(QueueName.class);

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        for (JobHandler<?> handler : handlers) {
            JobHandler<?> previous = this.handlers.putIfAbsent(handler.queue(), handler);
            if (previous != null) {
                throw new IllegalStateException("Queue " + handler.queue().getQueueName() + " has two handlers: "
                                                + previous.getClass().getSimpleName() + " and "
                                                + handler.getClass().getSimpleName());
            }
        }
        log.info("JobHandlerRegistry initialized with handlers for {}.", this.handlers.keySet());
    }

    public Optional<JobHandler<?>> getHandler(QueueName queue) {
        return Optional.ofNullable(handlers.get(queue));
    }

    public Map<QueueName, JobHandler<?>> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }
}
