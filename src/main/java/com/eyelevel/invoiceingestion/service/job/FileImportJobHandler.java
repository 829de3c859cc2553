package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.exception.SourceAccessException;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.service.dedup.DeduplicationIndex;
import com.eyelevel.invoiceingestion.service.hash.ContentHasher;
import com.eyelevel.invoiceingestion.service.pipeline.DocumentRecordService;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobHandler;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.FileImportPayload;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import com.eyelevel.invoiceingestion.service.routing.FileRouter;
import com.eyelevel.invoiceingestion.service.routing.TerminalState;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettings;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.SourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads one remote file into local staging, deduplicates the downloaded copy and queues its import.
 * Cancellation of the import batch is checked before and after the download.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileImportJobHandler implements JobHandler<FileImportPayload> {

    static final String INVOICE_IMPORT_JOB = "import-invoice";

    private final PipelineSettingsProvider settingsProvider;
    private final SourceConnectorFactory connectorFactory;
    private final ContentHasher contentHasher;
    private final DeduplicationIndex deduplicationIndex;
    private final DocumentRecordService documentRecordService;
    private final FileRouter fileRouter;
    private final JobQueueService jobQueueService;
    private final ImportBatchService importBatchService;

    @Override
    public QueueName queue() {
        return QueueName.FILE_IMPORT;
    }

    @Override
    public Class<FileImportPayload> payloadType() {
        return FileImportPayload.class;
    }

    @Override
    public Object handle(final JobContext context, final FileImportPayload payload) throws Exception {
        final String logPrefix = "[FileImport: " + context.jobId() + ", File: " + payload.fileName() + "]";
        if (importBatchService.isCancelled(payload.importBatchId())) {
            log.warn("{} Import batch was cancelled before download.", logPrefix);
            return result(payload, "cancelled");
        }

        final PipelineSettings settings = settingsProvider.current();
        final SourceConnector remote = connectorFactory.getConnector(payload.sourceKind());
        final Path staged = Path.of(settings.stagingDir(), context.jobId() + "-" + payload.fileName());
        try {
            remote.download(payload.remotePath(), staged);
        } catch (IOException e) {
            Files.deleteIfExists(staged);
            throw new SourceAccessException("Download of " + payload.remotePath() + " failed: " + e.getMessage(), e);
        }
        log.info("{} Downloaded to {} ({} bytes).", logPrefix, staged, Files.size(staged));

        if (importBatchService.isCancelled(payload.importBatchId())) {
            log.warn("{} Import batch was cancelled during download. Removing the staged copy.", logPrefix);
            Files.deleteIfExists(staged);
            return result(payload, "cancelled");
        }

        try {
            final String digest = contentHasher.digest(staged);
            if (jobQueueService.isContentQueued(QueueName.INVOICE_IMPORT, digest)) {
                log.info("{} Same content is already queued for import. Leaving the remote file for a later scan.",
                         logPrefix);
                Files.deleteIfExists(staged);
                return result(payload, "already_queued");
            }
            final Optional<DocumentRecord> original = deduplicationIndex.findDuplicate(digest,
                                                                                       settings.retentionDays());
            if (original.isPresent()) {
                final DocumentRecord duplicate = documentRecordService.recordDuplicate(
                        payload.fileName(), digest, payload.sourceKind(), original.get(), payload.remotePath(),
                        payload.importBatchId());
                final String location = fileRouter.route(remote, settings.layoutFor(payload.folderTag()),
                                                         payload.remotePath(), TerminalState.DUPLICATE, null);
                documentRecordService.updateFileLocation(duplicate.getId(), location);
                Files.deleteIfExists(staged);
                return result(payload, "duplicate");
            }

            jobQueueService.enqueue(QueueName.INVOICE_IMPORT, INVOICE_IMPORT_JOB,
                                    new InvoiceImportPayload(staged.toString(), payload.fileName(), digest,
                                                             payload.sourceKind(), payload.folderTag(),
                                                             payload.remotePath(), payload.importBatchId()),
                                    payload.folderTag() == null ? payload.fileName()
                                                                : payload.folderTag() + "/" + payload.fileName());
            return result(payload, "queued");
        } catch (Exception e) {
            Files.deleteIfExists(staged);
            throw e;
        }
    }

    private static Map<String, Object> result(final FileImportPayload payload, final String outcome) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("fileName", payload.fileName());
        result.put("remotePath", payload.remotePath());
        result.put("outcome", outcome);
        return result;
    }
}
