package com.eyelevel.invoiceingestion.service.queue.payload;

import com.eyelevel.invoiceingestion.model.SourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Import one local file. For files fetched from a remote source, {@code remotePath} points at the original so
 * it can be routed on the remote side too.
 *
 * @param contentDigest pre-computed SHA-256 of the file
 */
public record InvoiceImportPayload(@NotBlank String localPath,
                                   @NotBlank String fileName,
                                   @NotBlank @Pattern(regexp = "[0-9a-f]{64}") String contentDigest,
                                   @NotNull SourceKind sourceKind,
                                   String folderTag,
                                   String remotePath,
                                   String importBatchId) implements JobPayload {
}
