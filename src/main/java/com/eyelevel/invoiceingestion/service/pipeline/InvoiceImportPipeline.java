package com.eyelevel.invoiceingestion.service.pipeline;

import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import com.eyelevel.invoiceingestion.model.Company;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.FailureReason;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionOutcome;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.FieldExtractionService;
import com.eyelevel.invoiceingestion.service.matching.CompanyDocumentService;
import com.eyelevel.invoiceingestion.service.matching.EntityMatcher;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import com.eyelevel.invoiceingestion.service.routing.FileRouter;
import com.eyelevel.invoiceingestion.service.routing.TerminalState;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettings;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.SourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import com.eyelevel.invoiceingestion.service.template.StandardField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports one file: records it, extracts and scores its fields, links it to a company and routes it to its
 * terminal folder.
 * <p>
 * Data-quality problems (no template, missing account number, unknown company) settle the document as
 * UNALLOCATED and are not errors. Any exception marks the document FAILED in its own transaction and is
 * rethrown so the queue can retry; the file is routed to the failed folder once no attempt is left.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceImportPipeline {

    /**
     * Fields reported as missing on a settled document, in reporting order.
     */
    static final List<StandardField> REVIEWED_FIELDS = List.of(StandardField.ACCOUNT_NUMBER,
                                                               StandardField.TOTAL_AMOUNT,
                                                               StandardField.INVOICE_NUMBER,
                                                               StandardField.VAT_AMOUNT,
                                                               StandardField.CUSTOMER_PO);

    private final PipelineSettingsProvider settingsProvider;
    private final DocumentRecordService documentRecordService;
    private final FieldExtractionService fieldExtractionService;
    private final EntityMatcher entityMatcher;
    private final CompanyDocumentService companyDocumentService;
    private final FileRouter fileRouter;
    private final SourceConnectorFactory connectorFactory;
    private final ImportBatchService importBatchService;

    public ImportOutcome run(final JobContext context, final InvoiceImportPayload payload) throws IOException {
        final String logPrefix = "[Import: " + context.jobId() + ", File: " + payload.fileName() + "]";
        if (importBatchService.isCancelled(payload.importBatchId())) {
            log.warn("{} Import batch {} was cancelled. Skipping.", logPrefix, payload.importBatchId());
            return ImportOutcome.skipped(payload.fileName(), null, null);
        }

        final PipelineSettings settings = settingsProvider.current();
        final Optional<DocumentRecord> settled = documentRecordService.findSettled(payload.contentDigest(),
                                                                                   payload.fileName());
        if (settled.isPresent()) {
            final DocumentRecord record = settled.get();
            log.info("{} Already settled as document {} ({}). Nothing to import.", logPrefix, record.getId(),
                     record.getStatus());
            finishRoutingIfLeftBehind(payload, settings, record);
            return ImportOutcome.skipped(payload.fileName(), record.getId(), record.getStatus());
        }

        final DocumentRecord record;
        try {
            record = documentRecordService.createProcessing(payload.fileName(), payload.contentDigest(),
                                                            payload.sourceKind(), sourceLocation(payload),
                                                            payload.importBatchId());
        } catch (DataIntegrityViolationException e) {
            return settleAsDuplicate(logPrefix, payload, settings);
        }

        try {
            return process(logPrefix, context, payload, settings, record);
        } catch (Exception e) {
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} Import failed on attempt {} of {}: {}", logPrefix, context.attemptsMade(),
                      context.maxAttempts(), message, e);
            documentRecordService.markFailed(record.getId(), message);
            if (isLastAttempt(context, e)) {
                routeQuietly(logPrefix, payload, settings, record.getId(), TerminalState.FAILED, message);
            }
            throw e;
        }
    }

    private ImportOutcome process(final String logPrefix, final JobContext context,
                                  final InvoiceImportPayload payload, final PipelineSettings settings,
                                  final DocumentRecord record) throws IOException {
        final Path localFile = Path.of(payload.localPath());
        if (!Files.isRegularFile(localFile)) {
            throw new IOException("File not found at " + payload.localPath());
        }
        final FileKind fileKind = FileKind.fromExtension(FilenameUtils.getExtension(payload.fileName()))
                                          .orElseThrow(() -> new UnrecoverableJobException(
                                                  "Unsupported file type: " + payload.fileName()));

        final ExtractionOutcome outcome = fieldExtractionService.extract(
                localFile, fileKind, new ExtractionContext(payload.fileName(), payload.contentDigest(), null), false);
        final ExtractionResult result = outcome.result();
        final List<String> missing = missingFields(result);

        final DocumentRecord settledRecord;
        if (!result.hasField(StandardField.ACCOUNT_NUMBER.getStandardName())) {
            settledRecord = documentRecordService.markUnallocated(record.getId(), outcome,
                                                                  FailureReason.MISSING_FIELDS,
                                                                  "Missing " + String.join(", ", missing));
        } else {
            final String accountNumber = result.field(StandardField.ACCOUNT_NUMBER.getStandardName()).orElseThrow();
            final Optional<Company> company = entityMatcher.match(accountNumber);
            if (company.isPresent()) {
                companyDocumentService.upsert(record, company.get(), outcome.documentType(), result);
                settledRecord = documentRecordService.markParsed(record.getId(), outcome, company.get().getId(),
                                                                 missing.isEmpty() ? null
                                                                         : "Missing " + String.join(", ", missing));
            } else {
                settledRecord = documentRecordService.markUnallocated(
                        record.getId(), outcome, FailureReason.NO_COMPANY_MATCH,
                        "No company with account number '" + accountNumber + "'");
            }
        }

        final String location = route(payload, settings, TerminalState.PROCESSED, null);
        documentRecordService.updateFileLocation(record.getId(), location);
        log.info("{} Settled as {} after attempt {}.", logPrefix, settledRecord.getStatus(), context.attemptsMade());
        return new ImportOutcome(record.getId(), payload.fileName(), settledRecord.getStatus(),
                                 settledRecord.getFailureReason(), outcome.confidenceScore(), location, false);
    }

    private ImportOutcome settleAsDuplicate(final String logPrefix, final InvoiceImportPayload payload,
                                            final PipelineSettings settings) throws IOException {
        final DocumentRecord original = documentRecordService.findLiveOriginal(payload.contentDigest())
                                                             .orElseThrow(() -> new IllegalStateException(
                                                                     "Lost the race for digest "
                                                                     + payload.contentDigest()
                                                                     + " but no original exists"));
        log.info("{} Content is already held by document {}. Recording a duplicate.", logPrefix, original.getId());
        final DocumentRecord duplicate = documentRecordService.recordDuplicate(payload.fileName(),
                                                                               payload.contentDigest(),
                                                                               payload.sourceKind(), original,
                                                                               sourceLocation(payload),
                                                                               payload.importBatchId());
        final String location = route(payload, settings, TerminalState.DUPLICATE, null);
        documentRecordService.updateFileLocation(duplicate.getId(), location);
        return new ImportOutcome(duplicate.getId(), payload.fileName(), DocumentStatus.DUPLICATE,
                                 FailureReason.DUPLICATE, null, location, false);
    }

    /**
     * A replayed job may find its document settled while the file still sits in the drop folder.
     */
    private void finishRoutingIfLeftBehind(final InvoiceImportPayload payload, final PipelineSettings settings,
                                           final DocumentRecord record) throws IOException {
        if (!Files.exists(Path.of(payload.localPath()))) {
            return;
        }
        final TerminalState state = record.getStatus() == DocumentStatus.DUPLICATE ? TerminalState.DUPLICATE
                                                                                   : TerminalState.PROCESSED;
        documentRecordService.updateFileLocation(record.getId(), route(payload, settings, state, null));
    }

    /**
     * Routes the original file. A remotely sourced file is moved on its remote server and the staged copy is
     * removed.
     */
    private String route(final InvoiceImportPayload payload, final PipelineSettings settings,
                         final TerminalState state, final String errorMessage) throws IOException {
        final SourceLayout layout = settings.layoutFor(payload.folderTag());
        if (isRemote(payload)) {
            final SourceConnector remote = connectorFactory.getConnector(payload.sourceKind());
            final String location = fileRouter.route(remote, layout, payload.remotePath(), state, errorMessage);
            Files.deleteIfExists(Path.of(payload.localPath()));
            return location;
        }
        return fileRouter.route(connectorFactory.getConnector(SourceKind.LOCAL), layout, payload.localPath(), state,
                                errorMessage);
    }

    private void routeQuietly(final String logPrefix, final InvoiceImportPayload payload,
                              final PipelineSettings settings, final Long recordId, final TerminalState state,
                              final String errorMessage) {
        try {
            documentRecordService.updateFileLocation(recordId, route(payload, settings, state, errorMessage));
        } catch (Exception routeError) {
            log.error("{} Could not route the file to {}. It stays where it is.", logPrefix, state, routeError);
        }
    }

    static List<String> missingFields(final ExtractionResult result) {
        final List<String> missing = new ArrayList<>();
        for (StandardField field : REVIEWED_FIELDS) {
            if (!result.hasField(field.getStandardName())) {
                missing.add(field.getStandardName());
            }
        }
        return missing;
    }

    private static boolean isLastAttempt(final JobContext context, final Exception error) {
        return error instanceof UnrecoverableJobException || context.attemptsMade() >= context.maxAttempts();
    }

    private static boolean isRemote(final InvoiceImportPayload payload) {
        return payload.remotePath() != null
               && (payload.sourceKind() == SourceKind.FTP || payload.sourceKind() == SourceKind.SFTP);
    }

    private static String sourceLocation(final InvoiceImportPayload payload) {
        return isRemote(payload) ? payload.remotePath() : payload.localPath();
    }
}
