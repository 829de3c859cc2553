package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The immutable outcome of extracting one document. Fields are keyed by standard name (custom fields keep
 * their template name) and hold only values that were actually found.
 */
public record ExtractionResult(Map<String, String> fields,
                               String fullText,
                               ProcessingMethod processingMethod,
                               List<String> warnings,
                               Long templateId,
                               DocumentType documentType) {

    public ExtractionResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        warnings = List.copyOf(warnings);
        fullText = fullText == null ? "" : fullText;
    }

    /**
     * @return the trimmed value of the field, empty when it is absent or blank
     */
    public Optional<String> field(final String name) {
        return Optional.ofNullable(fields.get(name)).map(String::trim).filter(value -> !value.isEmpty());
    }

    public boolean hasField(final String name) {
        return field(name).isPresent();
    }

    public ExtractionResult withWarnings(final List<String> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        final List<String> merged = new ArrayList<>(warnings);
        merged.addAll(additional);
        return new ExtractionResult(fields, fullText, processingMethod, merged, templateId, documentType);
    }
}
