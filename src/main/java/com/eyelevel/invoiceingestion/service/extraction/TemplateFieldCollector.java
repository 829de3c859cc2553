package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FieldDefinition;
import com.eyelevel.invoiceingestion.service.template.StandardField;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a template's field definitions in two phases. Crucial fields are read first; if any of them yields
 * nothing the walk stops and records {@code missing_crucial_fields}. Otherwise the remaining fields follow in
 * standard parsing order.
 */
@Slf4j
public final class TemplateFieldCollector {

    public static final String MISSING_CRUCIAL_FIELDS = "missing_crucial_fields";

    private static final Set<StandardField> AMOUNT_FIELDS =
            EnumSet.of(StandardField.TOTAL_AMOUNT, StandardField.VAT_AMOUNT, StandardField.GOODS_AMOUNT);

    /**
     * Reads the raw text of one field from an already opened document.
     */
    @FunctionalInterface
    public interface FieldReader {
        String read(String fieldName, FieldDefinition definition, List<String> warnings) throws IOException;
    }

    public record Collected(Map<String, String> fields, List<String> warnings, String fullText) {
    }

    private TemplateFieldCollector() {
    }

    public static boolean isAmountField(final String fieldName) {
        return StandardField.fromName(fieldName).filter(AMOUNT_FIELDS::contains).isPresent();
    }

    public static Collected collect(final ExtractionTemplate template, final FieldReader reader) throws IOException {
        final Map<String, FieldDefinition> definitions = template.getFieldDefinitions();
        final List<String> ordered = StandardField.inParsingOrder(definitions.keySet());
        final Map<String, String> fields = new LinkedHashMap<>();
        final List<String> warnings = new ArrayList<>();

        final List<String> missingCrucial = new ArrayList<>();
        for (String name : ordered) {
            if (!isCrucial(name)) {
                continue;
            }
            final String value = readValue(name, definitions.get(name), reader, warnings);
            if (value == null) {
                missingCrucial.add(StandardField.canonicalName(name));
            } else {
                fields.put(StandardField.canonicalName(name), value);
            }
        }
        if (!missingCrucial.isEmpty()) {
            log.warn("Template '{}' yielded no value for crucial field(s) {}. Stopping extraction early.",
                     template.getCode(), missingCrucial);
            warnings.add(MISSING_CRUCIAL_FIELDS + ": " + String.join(", ", missingCrucial));
            return new Collected(fields, warnings, fullText(fields));
        }

        for (String name : ordered) {
            if (isCrucial(name)) {
                continue;
            }
            final String value = readValue(name, definitions.get(name), reader, warnings);
            if (value != null) {
                fields.put(StandardField.canonicalName(name), value);
            }
        }
        return new Collected(fields, warnings, fullText(fields));
    }

    private static boolean isCrucial(final String name) {
        return StandardField.fromName(name).map(StandardField::isCrucial).orElse(false);
    }

    private static String readValue(final String name, final FieldDefinition definition, final FieldReader reader,
                                    final List<String> warnings) throws IOException {
        if (definition == null) {
            return null;
        }
        final String raw = reader.read(name, definition, warnings);
        if (raw == null || raw.isBlank()) {
            log.debug("No text found for field '{}'.", name);
            return null;
        }
        String value = ValueTransformer.apply(raw, definition.getTransformations());
        if (value != null && isAmountField(name)) {
            value = ExtractedValueParser.cleanAmount(value);
            if (value.isEmpty()) {
                value = null;
            }
        }
        return value;
    }

    private static String fullText(final Map<String, String> fields) {
        final StringBuilder text = new StringBuilder();
        fields.forEach((name, value) -> text.append(name).append(": ").append(value).append('\n'));
        return text.toString().trim();
    }
}
