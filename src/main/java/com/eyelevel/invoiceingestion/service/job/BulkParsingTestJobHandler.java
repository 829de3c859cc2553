package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionOutcome;
import com.eyelevel.invoiceingestion.service.extraction.FieldExtractionService;
import com.eyelevel.invoiceingestion.service.hash.ContentHasher;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobHandler;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.BulkParsingTestPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dry-runs extraction against a file so template authors can check their templates. Only templates of the
 * classified type are used and nothing is persisted. Failures are reported in the result, never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BulkParsingTestJobHandler implements JobHandler<BulkParsingTestPayload> {

    private final FieldExtractionService fieldExtractionService;
    private final ContentHasher contentHasher;

    @Override
    public QueueName queue() {
        return QueueName.BULK_PARSING_TEST;
    }

    @Override
    public Class<BulkParsingTestPayload> payloadType() {
        return BulkParsingTestPayload.class;
    }

    @Override
    public Object handle(final JobContext context, final BulkParsingTestPayload payload) {
        final long started = System.currentTimeMillis();
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("testId", payload.testId());
        result.put("fileName", payload.fileName());
        try {
            final Path file = Path.of(payload.filePath());
            if (!Files.isRegularFile(file)) {
                return failure(result, "File not found: " + payload.filePath(), started);
            }
            final Optional<FileKind> kind = FileKind.fromExtension(FilenameUtils.getExtension(payload.fileName()));
            if (kind.isEmpty()) {
                return failure(result, "Unsupported file type: " + payload.fileName(), started);
            }
            final String digest = contentHasher.digest(file);
            final ExtractionOutcome outcome = fieldExtractionService.extract(
                    file, kind.get(), new ExtractionContext(payload.fileName(), digest, null), true);
            final String text = outcome.rawText();
            result.put("success", true);
            result.put("documentType", outcome.documentType().getTag());
            result.put("processingMethod", outcome.result().processingMethod().getTag());
            result.put("templateId", outcome.result().templateId());
            result.put("confidence", outcome.confidenceScore());
            result.put("fields", outcome.result().fields());
            result.put("warnings", outcome.result().warnings());
            result.put("textLength", text.length());
            result.put("wordCount", text.isBlank() ? 0 : text.trim().split("\\s+").length);
            result.put("processingTimeMs", System.currentTimeMillis() - started);
            log.info("[ParsingTest: {}] '{}' parsed with confidence {}.", payload.testId(), payload.fileName(),
                     outcome.confidenceScore());
            return result;
        } catch (Exception e) {
            log.warn("[ParsingTest: {}] '{}' could not be parsed.", payload.testId(), payload.fileName(), e);
            return failure(result, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), started);
        }
    }

    private static Map<String, Object> failure(final Map<String, Object> result, final String error,
                                               final long started) {
        result.put("success", false);
        result.put("error", error);
        result.put("fields", Map.of());
        result.put("warnings", List.of());
        result.put("processingTimeMs", System.currentTimeMillis() - started);
        return result;
    }
}
