package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Run-level statistics of one source scan, kept for operational visibility.
 */
@Entity
@Table(name = "scan_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SourceKind sourceKind;

    private int scanned;
    private int queued;
    private int skipped;
    private int duplicates;
    private int failed;
    private long durationMs;

    @Column(columnDefinition = "TEXT")
    private String errors;

    @Column(nullable = false)
    private LocalDateTime startedAt;
}
