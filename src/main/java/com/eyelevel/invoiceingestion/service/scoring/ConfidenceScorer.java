package com.eyelevel.invoiceingestion.service.scoring;

import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.template.StandardField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores an extraction from 0 to 100. The weights are fixed:
 * <ul>
 *     <li>40% base quality, from the provider confidence or the processing method default</li>
 *     <li>35% template field coverage plus 10% mandatory field coverage, or with no template 15% for an
 *     invoice number and 10% for a date</li>
 *     <li>up to 15% text quality</li>
 *     <li>up to 10% plausibility of key values</li>
 * </ul>
 */
@Slf4j
@Component
public class ConfidenceScorer {

    private static final Pattern AMOUNT_LIKE = Pattern.compile("[\\d.,£$€]");

    public int score(final ExtractionResult result, final ExtractionTemplate template) {
        return score(result, template, null);
    }

    /**
     * @param providerConfidence provider-reported confidence between 0 and 1, or {@code null}
     */
    public int score(final ExtractionResult result, final ExtractionTemplate template, final Double providerConfidence) {
        double total = 0.40 * baseQuality(result, providerConfidence);

        if (template != null) {
            final Set<String> present = result.fields().entrySet().stream()
                                              .filter(entry -> entry.getValue() != null && !entry.getValue().isBlank())
                                              .map(entry -> fuzzy(entry.getKey()))
                                              .collect(Collectors.toSet());
            final Collection<String> templateFields = template.getFieldDefinitions().keySet();
            if (!templateFields.isEmpty()) {
                total += 0.35 * coverage(templateFields, present);
                if (!template.getMandatoryFields().isEmpty()) {
                    total += 0.10 * coverage(template.getMandatoryFields(), present);
                }
            }
        } else {
            total += result.hasField("invoiceNumber") ? 0.15 : 0;
            total += result.hasField("invoiceDate") ? 0.10 : 0;
        }

        if (!result.fullText().isEmpty()) {
            total += Math.min(result.fullText().length() / 2000.0, 0.10);
            total += result.hasField("totalAmount") ? 0.05 : 0;
        }

        double plausibility = 0;
        if (result.hasField("invoiceNumber")) {
            plausibility += 0.03;
        }
        if (result.hasField("invoiceDate")) {
            plausibility += 0.03;
        }
        if (result.field("totalAmount").filter(value -> AMOUNT_LIKE.matcher(value).find()).isPresent()) {
            plausibility += 0.04;
        }
        total += Math.min(plausibility, 0.10);

        final int score = (int) Math.round(Math.min(total, 1.0) * 100);
        log.debug("Confidence {} for {} extraction with {} field(s).", score, result.processingMethod(),
                  result.fields().size());
        return score;
    }

    private static double baseQuality(final ExtractionResult result, final Double providerConfidence) {
        if (providerConfidence != null) {
            return Math.max(0, Math.min(providerConfidence, 1.0));
        }
        return result.processingMethod().getDefaultBaseQuality();
    }

    private static double coverage(final Collection<String> expected, final Set<String> present) {
        final long found = expected.stream()
                                      .map(StandardField::canonicalName)
                                      .map(ConfidenceScorer::fuzzy).filter(present::contains).count();
        return (double) found / expected.size();
    }

    /**
     * camelCase, snake_case and differently cased spellings of a field name compare equal.
     */
    static String fuzzy(final String fieldName) {
        return fieldName.toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]", "");
    }
}
