package com.eyelevel.invoiceingestion.service.queue.payload;

import jakarta.validation.constraints.NotBlank;

public record BulkParsingTestPayload(@NotBlank String filePath,
                                     @NotBlank String fileName,
                                     @NotBlank String testId) implements JobPayload {
}
