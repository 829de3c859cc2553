package com.eyelevel.invoiceingestion.service.queue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The durable job queues and their default retry, concurrency and lock settings.
 */
public enum QueueName {
    FILE_IMPORT("file-import", 3, 2_000L, 1, 60_000L),
    BULK_PARSING_TEST("bulk-parsing-test", 2, 1_000L, 2, 120_000L),
    INVOICE_IMPORT("invoice-import", 2, 2_000L, 2, 120_000L),
    EMAIL("email", 10, 60_000L, 1, 60_000L),
    SCHEDULED_TASKS("scheduled-tasks", 3, 5_000L, 1, 60_000L);

    public static final long DEFAULT_STALLED_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_MAX_STALLED_COUNT = 2;

    private final String queueName;
    private final int defaultAttempts;
    private final long defaultBackoffDelayMs;
    private final int defaultConcurrency;
    private final long defaultLockDurationMs;

    QueueName(String queueName, int defaultAttempts, long defaultBackoffDelayMs, int defaultConcurrency,
              long defaultLockDurationMs) {
        this.queueName = queueName;
        this.defaultAttempts = defaultAttempts;
        this.defaultBackoffDelayMs = defaultBackoffDelayMs;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultLockDurationMs = defaultLockDurationMs;
    }

    public String getQueueName() {
        return queueName;
    }

    public int getDefaultAttempts() {
        return defaultAttempts;
    }

    public long getDefaultBackoffDelayMs() {
        return defaultBackoffDelayMs;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public long getDefaultLockDurationMs() {
        return defaultLockDurationMs;
    }

    public static Optional<QueueName> fromQueueName(String name) {
        return Arrays.stream(values()).filter(queue -> queue.queueName.equals(name)).findFirst();
    }
}
