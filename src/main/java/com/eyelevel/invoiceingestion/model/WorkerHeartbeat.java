package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Liveness state of a worker process, refreshed on a fixed interval. A row whose {@code expiresAt} has
 * passed belongs to a dead process.
 */
@Entity
@Table(name = "worker_heartbeat")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerHeartbeat {

    @Id
    @Column(length = 128)
    private String instanceId;

    private long pid;

    private long uptimeSeconds;

    private int workerCount;

    @Column(nullable = false)
    private LocalDateTime beatAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;
}
