package com.eyelevel.invoiceingestion.controller;

import com.eyelevel.invoiceingestion.dto.common.ApiResponse;
import com.eyelevel.invoiceingestion.dto.operations.BatchCancelResponse;
import com.eyelevel.invoiceingestion.dto.operations.BulkParsingTestRequest;
import com.eyelevel.invoiceingestion.dto.operations.JobQueuedResponse;
import com.eyelevel.invoiceingestion.dto.operations.TemplateDefaultResponse;
import com.eyelevel.invoiceingestion.model.DeadLetterRecord;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.service.job.ScheduledTaskJobHandler;
import com.eyelevel.invoiceingestion.service.queue.DeadLetterService;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueCounts;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.BulkParsingTestPayload;
import com.eyelevel.invoiceingestion.service.queue.payload.ScheduledTaskPayload;
import com.eyelevel.invoiceingestion.service.source.SourcePaths;
import com.eyelevel.invoiceingestion.service.template.TemplateService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for operating the ingestion pipeline.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/operations/v1")
@RequiredArgsConstructor
@Validated
public class OperationsController implements OperationsApi {

    private final JobQueueService jobQueueService;
    private final DeadLetterService deadLetterService;
    private final ImportBatchService importBatchService;
    private final TemplateService templateService;

    @Override
    @PostMapping("/scans")
    public ResponseEntity<ApiResponse<JobQueuedResponse>> triggerScan() {
        log.info("Manual source scan requested.");
        final QueueJob job = jobQueueService.enqueue(QueueName.SCHEDULED_TASKS, ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN,
                                                     new ScheduledTaskPayload(ScheduledTaskJobHandler.LOCAL_FOLDER_SCAN));
        return ResponseEntity.ok(ApiResponse.ok(queued(job), "Source scan queued."));
    }

    @Override
    @GetMapping("/queues/health")
    public ResponseEntity<ApiResponse<List<QueueCounts>>> queueHealth() {
        final List<QueueCounts> counts = Arrays.stream(QueueName.values()).map(jobQueueService::counts).toList();
        return ResponseEntity.ok(ApiResponse.ok(counts, null));
    }

    @Override
    @GetMapping("/dead-letters")
    public ResponseEntity<ApiResponse<Page<DeadLetterRecord>>> deadLetters(
            @RequestParam(value = "page", defaultValue = "0") @Min(0) final int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(200) final int size) {
        return ResponseEntity.ok(ApiResponse.ok(deadLetterService.list(PageRequest.of(page, size)), null));
    }

    @Override
    @PostMapping("/import-batches/{batchId}/cancel")
    public ResponseEntity<ApiResponse<BatchCancelResponse>> cancelImportBatch(
            @PathVariable("batchId") final String batchId) {
        log.info("Cancellation requested for import batch {}.", batchId);
        final int removed = importBatchService.cancel(batchId);
        return ResponseEntity.ok(ApiResponse.ok(new BatchCancelResponse(batchId, removed),
                                                "Import batch cancelled. Removed " + removed + " queued job(s)."));
    }

    @Override
    @PostMapping("/templates/{templateId}/default")
    public ResponseEntity<ApiResponse<TemplateDefaultResponse>> setDefaultTemplate(
            @PathVariable("templateId") final Long templateId) {
        final ExtractionTemplate template = templateService.setAsDefault(templateId);
        return ResponseEntity.ok(ApiResponse.ok(new TemplateDefaultResponse(template.getId(), template.getCode(),
                                                                            template.getDocumentType(),
                                                                            template.getFileKind()),
                                                "Template '" + template.getCode() + "' is now the default."));
    }

    @Override
    @PostMapping("/bulk-parsing-tests")
    public ResponseEntity<ApiResponse<JobQueuedResponse>> queueParsingTest(
            @Valid @RequestBody final BulkParsingTestRequest request) {
        final String fileName = StringUtils.hasText(request.fileName()) ? request.fileName()
                                                                        : SourcePaths.fileName(request.filePath());
        final String testId = StringUtils.hasText(request.testId()) ? request.testId() : UUID.randomUUID().toString();
        final QueueJob job = jobQueueService.enqueue(QueueName.BULK_PARSING_TEST, "parsing-test",
                                                     new BulkParsingTestPayload(request.filePath(), fileName, testId));
        return ResponseEntity.ok(ApiResponse.ok(queued(job), "Parsing test " + testId + " queued."));
    }

    private static JobQueuedResponse queued(final QueueJob job) {
        return new JobQueuedResponse(job.getId(), job.getQueueName(), job.getJobName());
    }
}
