package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.service.template.TemplateResolution;

/**
 * Everything learned about a document while extracting it.
 *
 * @param documentType    the classified type
 * @param resolution      how the template was chosen
 * @param result          the extracted fields, including resolution warnings
 * @param confidenceScore 0 to 100
 * @param rawText         the document text used for classification
 */
public record ExtractionOutcome(DocumentType documentType,
                                TemplateResolution resolution,
                                ExtractionResult result,
                                int confidenceScore,
                                String rawText) {
}
