package com.eyelevel.invoiceingestion.service.pipeline;

import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.FailureReason;

/**
 * The return value of an invoice-import job.
 *
 * @param skipped {@code true} when the job did nothing because the batch was cancelled or the file was already
 *                settled by an earlier run
 */
public record ImportOutcome(Long documentId,
                            String fileName,
                            DocumentStatus status,
                            FailureReason failureReason,
                            Integer confidenceScore,
                            String fileLocation,
                            boolean skipped) {

    static ImportOutcome skipped(final String fileName, final Long documentId, final DocumentStatus status) {
        return new ImportOutcome(documentId, fileName, status, null, null, null, true);
    }
}
