package com.eyelevel.invoiceingestion.dto.operations;

import jakarta.validation.constraints.NotBlank;

/**
 * @param fileName display name of the file; defaults to the last segment of {@code filePath}
 * @param testId   caller-chosen id to correlate results; generated when absent
 */
public record BulkParsingTestRequest(@NotBlank String filePath, String fileName, String testId) {
}
