package com.eyelevel.invoiceingestion.service.scan;

import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.ImportBatch;
import com.eyelevel.invoiceingestion.model.ScanRun;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import com.eyelevel.invoiceingestion.repository.ScanRunRepository;
import com.eyelevel.invoiceingestion.service.dedup.DeduplicationIndex;
import com.eyelevel.invoiceingestion.service.hash.ContentHasher;
import com.eyelevel.invoiceingestion.service.pipeline.DocumentRecordService;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.FileImportPayload;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import com.eyelevel.invoiceingestion.service.routing.FileRouter;
import com.eyelevel.invoiceingestion.service.routing.TerminalState;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettings;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.CandidateFile;
import com.eyelevel.invoiceingestion.service.source.SourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks the unprocessed folder of every configured drop folder and decides, per file, whether to queue it,
 * settle it as a duplicate or leave it for a later scan.
 * <p>
 * Local files are hashed and deduplicated here. Remote files are queued for download first; the file-import
 * job hashes and deduplicates the downloaded copy. A failure on one file is recorded and the scan moves on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceScanner {

    static final String INVOICE_IMPORT_JOB = "import-invoice";
    static final String FILE_IMPORT_JOB = "import-remote-file";

    private final PipelineSettingsProvider settingsProvider;
    private final SourceConnectorFactory connectorFactory;
    private final ContentHasher contentHasher;
    private final DeduplicationIndex deduplicationIndex;
    private final DocumentRecordService documentRecordService;
    private final DocumentRecordRepository documentRecordRepository;
    private final JobQueueService jobQueueService;
    private final ImportBatchService importBatchService;
    private final FileRouter fileRouter;
    private final ScanRunRepository scanRunRepository;

    public ScanResult scan() {
        return scan(settingsProvider.current());
    }

    public ScanResult scan(final PipelineSettings settings) {
        final long started = System.currentTimeMillis();
        final LocalDateTime startedAt = LocalDateTime.now();
        final SourceKind kind = settings.sourceKind();
        final SourceConnector connector = connectorFactory.getConnector(kind);
        final ImportBatch batch = importBatchService.open(kind);
        final Tally tally = new Tally();
        log.info("[Scan: {}] Starting scan of {} folder(s) as batch {}.", kind, settings.layouts().size(),
                 batch.getId());

        for (SourceLayout layout : settings.layouts()) {
            final List<CandidateFile> candidates;
            try {
                candidates = connector.list(layout.unprocessed());
            } catch (Exception e) {
                log.error("[Scan: {}] Could not list {}.", kind, layout.unprocessed(), e);
                tally.errors.add(layout.unprocessed() + ": " + e.getMessage());
                continue;
            }
            for (CandidateFile candidate : candidates) {
                if (!settings.acceptsExtension(candidate.extension())) {
                    continue;
                }
                tally.scanned++;
                try {
                    tally.record(candidate, scanFile(settings, connector, layout, candidate, batch.getId()));
                } catch (Exception e) {
                    final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.error("[Scan: {}, File: {}] Failed: {}", kind, candidate.displayName(), message, e);
                    tally.errors.add(candidate.displayName() + ": " + message);
                    tally.files.add(new ScanResult.FileOutcome(candidate.displayName(), layout.folderTag(),
                                                               ScanResult.Outcome.FAILED, message));
                    routeFailed(connector, layout, candidate, message);
                }
            }
        }

        importBatchService.recordCounts(batch.getId(), tally.scanned, tally.queued);
        final long durationMs = System.currentTimeMillis() - started;
        saveScanRun(kind, tally, durationMs, startedAt);
        log.info("[Scan: {}] Finished in {} ms. scanned={}, queued={}, duplicates={}, skipped={}, errors={}", kind,
                 durationMs, tally.scanned, tally.queued, tally.duplicates, tally.skipped, tally.errors.size());
        return new ScanResult(batch.getId(), tally.scanned, tally.queued, tally.duplicates, tally.skipped,
                              List.copyOf(tally.errors), List.copyOf(tally.files));
    }

    private ScanResult.FileOutcome scanFile(final PipelineSettings settings, final SourceConnector connector,
                                            final SourceLayout layout, final CandidateFile candidate,
                                            final String batchId) throws Exception {
        final String name = candidate.displayName();
        final String tag = layout.folderTag();
        final Instant youngest = Instant.now().minus(settings.minimumFileAge());
        if (candidate.mtime() != null && candidate.mtime().isAfter(youngest)) {
            log.debug("[Scan: {}] '{}' is younger than {} and may still be uploading.", settings.sourceKind(), name,
                      settings.minimumFileAge());
            return skipped(name, tag, "too_young");
        }

        final String dedupKey = dedupKey(tag, name);
        final QueueName queue = isRemote(settings.sourceKind()) ? QueueName.FILE_IMPORT : QueueName.INVOICE_IMPORT;
        if (jobQueueService.isQueued(queue, dedupKey)) {
            return skipped(name, tag, "already_queued");
        }
        final LocalDateTime recentWindow = LocalDateTime.now().minus(settings.recentlyProcessedWindow());
        if (documentRecordRepository.existsByFileNameAndCreatedAtAfter(name, recentWindow)) {
            return skipped(name, tag, "processed_recently");
        }

        if (isRemote(settings.sourceKind())) {
            jobQueueService.enqueue(QueueName.FILE_IMPORT, FILE_IMPORT_JOB,
                                    new FileImportPayload(settings.sourceKind(), candidate.sourcePath(), name, tag,
                                                          batchId),
                                    dedupKey);
            return new ScanResult.FileOutcome(name, tag, ScanResult.Outcome.QUEUED, null);
        }

        final String digest = contentHasher.digest(Path.of(candidate.sourcePath()));
        if (jobQueueService.isContentQueued(QueueName.INVOICE_IMPORT, digest)) {
            log.debug("[Scan: {}] '{}' has the same content as a queued import. Leaving it for a later scan.",
                      settings.sourceKind(), name);
            return skipped(name, tag, "already_queued");
        }
        final Optional<DocumentRecord> original = deduplicationIndex.findDuplicate(digest, settings.retentionDays());
        if (original.isPresent()) {
            final DocumentRecord duplicate = documentRecordService.recordDuplicate(name, digest,
                                                                                   settings.sourceKind(),
                                                                                   original.get(),
                                                                                   candidate.sourcePath(), batchId);
            final String location = fileRouter.route(connector, layout, candidate.sourcePath(),
                                                     TerminalState.DUPLICATE, null);
            documentRecordService.updateFileLocation(duplicate.getId(), location);
            return new ScanResult.FileOutcome(name, tag, ScanResult.Outcome.DUPLICATE,
                                              "duplicate_of:" + original.get().getId());
        }

        jobQueueService.enqueue(QueueName.INVOICE_IMPORT, INVOICE_IMPORT_JOB,
                                new InvoiceImportPayload(candidate.sourcePath(), name, digest,
                                                         settings.sourceKind(), tag, null, batchId),
                                dedupKey);
        return new ScanResult.FileOutcome(name, tag, ScanResult.Outcome.QUEUED, null);
    }

    private void routeFailed(final SourceConnector connector, final SourceLayout layout,
                             final CandidateFile candidate, final String message) {
        try {
            fileRouter.route(connector, layout, candidate.sourcePath(), TerminalState.FAILED, message);
        } catch (Exception e) {
            log.error("Could not move '{}' to the failed folder. It stays in {}.", candidate.displayName(),
                      layout.unprocessed(), e);
        }
    }

    private void saveScanRun(final SourceKind kind, final Tally tally, final long durationMs,
                             final LocalDateTime startedAt) {
        try {
            scanRunRepository.save(ScanRun.builder()
                                          .sourceKind(kind)
                                          .scanned(tally.scanned)
                                          .queued(tally.queued)
                                          .skipped(tally.skipped)
                                          .duplicates(tally.duplicates)
                                          .failed(tally.errors.size())
                                          .durationMs(durationMs)
                                          .errors(tally.errors.isEmpty() ? null : String.join("\n", tally.errors))
                                          .startedAt(startedAt)
                                          .build());
        } catch (Exception e) {
            log.error("[Scan: {}] Could not record scan statistics.", kind, e);
        }
    }

    static String dedupKey(final String folderTag, final String fileName) {
        return folderTag == null ? fileName : folderTag + "/" + fileName;
    }

    private static boolean isRemote(final SourceKind kind) {
        return kind == SourceKind.FTP || kind == SourceKind.SFTP;
    }

    private static ScanResult.FileOutcome skipped(final String name, final String tag, final String reason) {
        return new ScanResult.FileOutcome(name, tag, ScanResult.Outcome.SKIPPED, reason);
    }

    private static final class Tally {
        private int scanned;
        private int queued;
        private int duplicates;
        private int skipped;
        private final List<String> errors = new ArrayList<>();
        private final List<ScanResult.FileOutcome> files = new ArrayList<>();

        private void record(final CandidateFile candidate, final ScanResult.FileOutcome outcome) {
            switch (outcome.outcome()) {
                case QUEUED -> queued++;
                case DUPLICATE -> duplicates++;
                case SKIPPED -> skipped++;
                case FAILED -> errors.add(candidate.displayName() + ": " + outcome.detail());
            }
            files.add(outcome);
        }
    }
}
