package com.eyelevel.invoiceingestion.service.queue.payload;

import com.eyelevel.invoiceingestion.model.SourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Download one remote file into local staging before import.
 */
public record FileImportPayload(@NotNull SourceKind sourceKind,
                                @NotBlank String remotePath,
                                @NotBlank String fileName,
                                String folderTag,
                                String importBatchId) implements JobPayload {
}
