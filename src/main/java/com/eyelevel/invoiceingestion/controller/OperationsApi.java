package com.eyelevel.invoiceingestion.controller;

import com.eyelevel.invoiceingestion.dto.common.ApiResponse;
import com.eyelevel.invoiceingestion.dto.operations.BatchCancelResponse;
import com.eyelevel.invoiceingestion.dto.operations.BulkParsingTestRequest;
import com.eyelevel.invoiceingestion.dto.operations.JobQueuedResponse;
import com.eyelevel.invoiceingestion.dto.operations.TemplateDefaultResponse;
import com.eyelevel.invoiceingestion.model.DeadLetterRecord;
import com.eyelevel.invoiceingestion.service.queue.QueueCounts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Ingestion Operations", description = "Endpoints for operating the ingestion pipeline: scans, queue health, dead letters, batch cancellation and templates.")
public interface OperationsApi {

    @Operation(summary = "Trigger Source Scan",
            description = "Queues a scan of the configured drop folder outside the polling schedule. The scan runs on the scheduled-tasks queue.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Scan queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Source scan queued.",
                                        "response": {
                                            "jobId": 17,
                                            "queueName": "scheduled-tasks",
                                            "jobName": "local-folder-scan"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<JobQueuedResponse>> triggerScan();

    @Operation(summary = "Queue Health", description = "Returns the waiting, active, delayed, completed and failed job counts of every queue.")
    ResponseEntity<ApiResponse<List<QueueCounts>>> queueHealth();

    @Operation(summary = "List Dead Letters", description = "Returns jobs that failed permanently or exhausted their retries, newest first.")
    ResponseEntity<ApiResponse<Page<DeadLetterRecord>>> deadLetters(
            @Parameter(description = "Zero-based page index.", example = "0")
            @RequestParam(value = "page", defaultValue = "0") int page,
            @Parameter(description = "Page size, at most 200.", example = "20")
            @RequestParam(value = "size", defaultValue = "20") int size);

    @Operation(summary = "Cancel Import Batch",
            description = "Marks the batch as cancelled and removes its queued jobs. Jobs already running stop at their next file boundary.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch cancelled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown batch.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchCancelResponse>> cancelImportBatch(
            @Parameter(description = "The import batch id.", required = true) @PathVariable("batchId") String batchId);

    @Operation(summary = "Set Default Template",
            description = "Makes the template the default for its supplier, document type and file kind, and unsets the previous default.")
    ResponseEntity<ApiResponse<TemplateDefaultResponse>> setDefaultTemplate(
            @Parameter(description = "The template id.", required = true) @PathVariable("templateId") Long templateId);

    @Operation(summary = "Queue Parsing Test",
            description = "Queues a dry-run extraction of a local file. Nothing is persisted; the result is stored on the job.")
    ResponseEntity<ApiResponse<JobQueuedResponse>> queueParsingTest(@Valid @RequestBody BulkParsingTestRequest request);
}
