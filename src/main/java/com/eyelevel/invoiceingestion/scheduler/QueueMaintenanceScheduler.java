package com.eyelevel.invoiceingestion.scheduler;

import com.eyelevel.invoiceingestion.service.queue.HeartbeatService;
import com.eyelevel.invoiceingestion.service.queue.QueueHealthMonitor;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.QueueRetentionService;
import com.eyelevel.invoiceingestion.service.queue.StalledJobMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the periodic queue housekeeping: stall recovery, health sampling, the worker heartbeat and the
 * retention sweep. Each run isolates failures so one broken queue never blocks the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueMaintenanceScheduler {

    private final StalledJobMonitor stalledJobMonitor;
    private final QueueHealthMonitor queueHealthMonitor;
    private final HeartbeatService heartbeatService;
    private final QueueRetentionService queueRetentionService;

    @Scheduled(fixedDelayString = "${app.scheduler.stalled-check-ms:30000}",
               initialDelayString = "${app.scheduler.stalled-check-ms:30000}")
    public void recoverStalledJobs() {
        for (QueueName queue : QueueName.values()) {
            try {
                stalledJobMonitor.checkStalled(queue);
            } catch (Exception e) {
                log.error("[Queue: {}] Stall check failed. It will be re-checked on the next run.",
                          queue.getQueueName(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${app.scheduler.health-check-ms:60000}")
    public void checkHealth() {
        queueHealthMonitor.check();
    }

    @Scheduled(fixedDelayString = "${app.scheduler.heartbeat-ms:30000}")
    public void heartbeat() {
        try {
            heartbeatService.beat();
        } catch (Exception e) {
            log.error("Failed to write the worker heartbeat.", e);
        }
    }

    @Scheduled(cron = "${app.scheduler.queue-retention:0 0 * * * *}")
    public void sweepFinishedJobs() {
        try {
            final int deleted = queueRetentionService.sweep();
            log.info("Queue retention sweep finished. Deleted {} finished job(s).", deleted);
        } catch (Exception e) {
            log.error("Queue retention sweep failed. It will run again on the next schedule.", e);
        }
    }
}
