package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Audit copy of a job that failed terminally. Rows are append-only and never expire.
 */
@Entity
@Immutable
@Table(name = "dead_letter_record", indexes = @Index(name = "idx_dead_letter_queue", columnList = "original_queue"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_queue", nullable = false, length = 64)
    private String originalQueue;

    @Column(nullable = false)
    private Long originalJobId;

    @Column(nullable = false, length = 128)
    private String jobName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payloadSnapshot;

    @Column(columnDefinition = "TEXT")
    private String failureReason;

    @Column(columnDefinition = "TEXT")
    private String stackTrace;

    @Column(nullable = false)
    private int attemptsMade;

    @Column(nullable = false)
    private LocalDateTime failedAt;
}
