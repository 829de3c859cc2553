package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a document of one file kind, either as raw text for classification or field by field through a
 * template.
 */
public interface DocumentExtractor {

    boolean supports(FileKind fileKind);

    /**
     * Returns all readable text of the document, in reading order.
     */
    String readText(Path file) throws IOException;

    /**
     * Extracts every field the template defines. Fields that yield no value are left out of the result;
     * a missing value is not an error.
     *
     * @throws IOException when the document cannot be opened or read
     */
    ExtractionResult extract(Path file, ExtractionTemplate template, ExtractionContext context) throws IOException;
}
