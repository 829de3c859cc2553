package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;

import java.time.Duration;

/**
 * Effective settings of one queue: the built-in defaults with any configured overrides applied.
 */
public record QueuePolicy(QueueName queue,
                          int concurrency,
                          Duration lockDuration,
                          Duration stalledInterval,
                          int maxStalledCount,
                          int attempts,
                          Duration backoffDelay) {

    public static QueuePolicy resolve(final QueueName queue, final IngestionProperties properties) {
        final IngestionProperties.QueueOverride override =
                properties.getQueues().getOrDefault(queue.getQueueName(), new IngestionProperties.QueueOverride());
        return new QueuePolicy(
                queue,
                valueOr(override.getConcurrency(), queue.getDefaultConcurrency()),
                Duration.ofMillis(valueOr(override.getLockDurationMs(), queue.getDefaultLockDurationMs())),
                Duration.ofMillis(valueOr(override.getStalledIntervalMs(), QueueName.DEFAULT_STALLED_INTERVAL_MS)),
                valueOr(override.getMaxStalledCount(), QueueName.DEFAULT_MAX_STALLED_COUNT),
                valueOr(override.getAttempts(), queue.getDefaultAttempts()),
                Duration.ofMillis(valueOr(override.getBackoffDelayMs(), queue.getDefaultBackoffDelayMs())));
    }

    /**
     * Exponential backoff: {@code base * 2^(attemptsMade - 1)}.
     */
    public Duration backoffFor(final int attemptsMade) {
        final int exponent = Math.max(0, Math.min(attemptsMade - 1, 20));
        return backoffDelay.multipliedBy(1L << exponent);
    }

    private static <T> T valueOr(final T value, final T fallback) {
        return value != null ? value : fallback;
    }
}
