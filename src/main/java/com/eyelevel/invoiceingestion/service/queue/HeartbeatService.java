package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.WorkerHeartbeat;
import com.eyelevel.invoiceingestion.repository.WorkerHeartbeatRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.LocalDateTime;

/**
 * Publishes this process's liveness so that operators can tell a live worker pool from a dead one.
 */
@Slf4j
@Service
public class HeartbeatService {

    private final WorkerHeartbeatRepository heartbeatRepository;
    private final QueueWorkerManager workerManager;
    private final IngestionProperties properties;
    private final String instanceId;

    public HeartbeatService(WorkerHeartbeatRepository heartbeatRepository, QueueWorkerManager workerManager,
                            IngestionProperties properties) {
        this.heartbeatRepository = heartbeatRepository;
        this.workerManager = workerManager;
        this.properties = properties;
        this.instanceId = resolveHostName() + "-" + ProcessHandle.current().pid();
    }

    @Transactional
    public WorkerHeartbeat beat() {
        final LocalDateTime now = LocalDateTime.now();
        final WorkerHeartbeat heartbeat = heartbeatRepository.findById(instanceId)
                                                             .orElseGet(() -> WorkerHeartbeat.builder()
                                                                                             .instanceId(instanceId)
                                                                                             .build());
        heartbeat.setPid(ProcessHandle.current().pid());
        heartbeat.setUptimeSeconds(ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        heartbeat.setWorkerCount(workerManager.workerCount());
        heartbeat.setBeatAt(now);
        heartbeat.setExpiresAt(now.plusNanos(properties.getHealth().getHeartbeatTtlMs() * 1_000_000L));
        log.debug("[Heartbeat: {}] {} worker(s), up {} s.", instanceId, heartbeat.getWorkerCount(),
                  heartbeat.getUptimeSeconds());
        return heartbeatRepository.save(heartbeat);
    }

    public String getInstanceId() {
        return instanceId;
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve the local host name. Using 'localhost' for the heartbeat id.");
            return "localhost";
        }
    }
}
