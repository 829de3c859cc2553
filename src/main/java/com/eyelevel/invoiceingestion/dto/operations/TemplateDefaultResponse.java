package com.eyelevel.invoiceingestion.dto.operations;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.FileKind;

public record TemplateDefaultResponse(Long templateId, String code, DocumentType documentType, FileKind fileKind) {
}
