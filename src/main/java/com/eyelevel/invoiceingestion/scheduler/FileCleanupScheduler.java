package com.eyelevel.invoiceingestion.scheduler;

import com.eyelevel.invoiceingestion.service.job.ScheduledTaskJobHandler;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.ScheduledTaskPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Queues the daily document retention cleanup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileCleanupScheduler {

    private final JobQueueService jobQueueService;

    @Scheduled(cron = "${app.scheduler.file-cleanup:0 0 2 * * *}")
    public void queueCleanup() {
        log.info("Queueing the daily file cleanup.");
        try {
            jobQueueService.enqueue(QueueName.SCHEDULED_TASKS, ScheduledTaskJobHandler.FILE_CLEANUP,
                                    new ScheduledTaskPayload(ScheduledTaskJobHandler.FILE_CLEANUP));
        } catch (Exception e) {
            log.error("Failed to queue the file cleanup. It will run on the next schedule.", e);
        }
    }
}
