package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.DocumentType;

/**
 * Per-file facts an extractor may need beyond the file itself.
 *
 * @param fileName      the display name, for logging
 * @param contentDigest the content digest, used as the document fingerprint for page layout caching
 * @param detectedType  the type assigned by the classifier
 */
public record ExtractionContext(String fileName, String contentDigest, DocumentType detectedType) {
}
