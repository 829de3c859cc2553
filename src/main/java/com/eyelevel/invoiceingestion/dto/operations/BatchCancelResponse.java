package com.eyelevel.invoiceingestion.dto.operations;

public record BatchCancelResponse(String importBatchId, int removedJobs) {
}
