package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A durable unit of work on one of the named queues.
 * <p>
 * Only the worker holding {@code lockToken} may complete, fail or renew an {@code ACTIVE} job; every such
 * transition is an atomic conditional update on the token.
 */
@Entity
@Table(name = "queue_job", indexes = {
        @Index(name = "idx_queue_job_poll", columnList = "queue_name, status, available_at"),
        @Index(name = "idx_queue_job_dedup", columnList = "queue_name, dedup_key, status"),
        @Index(name = "idx_queue_job_digest", columnList = "queue_name, content_digest, status"),
        @Index(name = "idx_queue_job_batch", columnList = "import_batch_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_name", nullable = false, length = 64)
    private String queueName;

    @Column(nullable = false, length = 128)
    private String jobName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "dedup_key", length = 512)
    private String dedupKey;

    @Column(name = "content_digest", length = 64)
    private String contentDigest;

    @Column(name = "import_batch_id", length = 64)
    private String importBatchId;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 0;

    @Builder.Default
    @Column(nullable = false)
    private int attemptsMade = 0;

    @Column(nullable = false)
    private int maxAttempts;

    @Builder.Default
    @Column(nullable = false)
    private int stalledCount = 0;

    @Column(length = 64)
    private String lockToken;

    private LocalDateTime lockExpiresAt;

    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(columnDefinition = "TEXT")
    private String returnValue;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime finishedAt;
}
