package com.eyelevel.invoiceingestion.scheduler;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.service.job.ScheduledTaskJobHandler;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.ScheduledTaskPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Queues a source scan on the cron derived from {@code pollingFrequencyMinutes}. Nothing is queued while the
 * source is disabled, or while the previous scan is still waiting or running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourcePollingScheduler implements SchedulingConfigurer {

    private final IngestionProperties properties;
    private final JobQueueService jobQueueService;

    @Override
    public void configureTasks(final ScheduledTaskRegistrar registrar) {
        final String cron = PollingCron.fromMinutes(properties.getSource().getPollingFrequencyMinutes());
        log.info("Source polling every {} minute(s) on cron '{}'.", properties.getSource().getPollingFrequencyMinutes(),
                 cron);
        registrar.addCronTask(this::triggerScan, cron);
    }

    /**
     * @return {@code true} if a scan job was queued
     */
    public boolean triggerScan() {
        if (!properties.getSource().isEnabled()) {
            log.debug("Source polling is disabled. No scan queued.");
            return false;
        }
        try {
            if (jobQueueService.isQueued(QueueName.SCHEDULED_TASKS, ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN)) {
                log.info("A source scan is already pending. Skipping this trigger.");
                return false;
            }
            jobQueueService.enqueue(QueueName.SCHEDULED_TASKS, ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN,
                                    new ScheduledTaskPayload(ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN),
                                    ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN);
            log.info("Queued a {} source scan.", properties.getSource().getKind());
            return true;
        } catch (Exception e) {
            log.error("Failed to queue the source scan. It will be retried on the next trigger.", e);
            return false;
        }
    }
}
