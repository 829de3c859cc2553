package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.service.cleanup.FileCleanupService;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobHandler;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.ScheduledTaskPayload;
import com.eyelevel.invoiceingestion.service.scan.ScanResult;
import com.eyelevel.invoiceingestion.service.scan.SourceScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs maintenance tasks queued by the schedulers, dispatching on the task name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledTaskJobHandler implements JobHandler<ScheduledTaskPayload> {

    public static final String FILE_CLEANUP = "file-cleanup";
    public static final String LOCAL_FOLDER_SCAN = "local-folder-scan";

    private final FileCleanupService fileCleanupService;
    private final SourceScanner sourceScanner;

    @Override
    public QueueName queue() {
        return QueueName.SCHEDULED_TASKS;
    }

    @Override
    public Class<ScheduledTaskPayload> payloadType() {
        return ScheduledTaskPayload.class;
    }

    @Override
    public Object handle(final JobContext context, final ScheduledTaskPayload payload) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("taskName", payload.taskName());
        switch (payload.taskName()) {
            case FILE_CLEANUP -> {
                result.put("success", true);
                result.put("deleted", fileCleanupService.cleanup());
            }
            case LOCAL_FOLDER_SCAN -> {
                final ScanResult scan = sourceScanner.scan();
                result.put("success", true);
                result.put("importBatchId", scan.importBatchId());
                result.put("scanned", scan.scanned());
                result.put("queued", scan.queued());
                result.put("duplicates", scan.duplicates());
                result.put("skipped", scan.skipped());
                result.put("errors", scan.errors());
            }
            default -> {
                log.warn("[Task: {}] Unknown scheduled task '{}'. Ignoring.", context.jobId(), payload.taskName());
                result.put("success", false);
                result.put("error", "Unknown task: " + payload.taskName());
            }
        }
        return result;
    }
}
