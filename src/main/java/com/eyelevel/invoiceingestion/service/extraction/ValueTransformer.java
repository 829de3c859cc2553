package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.FieldTransformations;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies a field's configured transformations to its raw text: substring removal, trimming, case folding,
 * then numeric or date normalisation.
 */
public final class ValueTransformer {

    private ValueTransformer() {
    }

    /**
     * @return the transformed value, or {@code null} when nothing is left
     */
    public static String apply(final String raw, final FieldTransformations transformations) {
        if (raw == null) {
            return null;
        }
        String value = raw;
        if (transformations != null) {
            for (String token : transformations.getRemove()) {
                if (token != null && !token.isEmpty()) {
                    value = value.replace(token, "");
                }
            }
            if (transformations.isTrim()) {
                value = value.trim();
            }
            if (transformations.isUppercase()) {
                value = value.toUpperCase(Locale.ROOT);
            }
            if (transformations.isLowercase()) {
                value = value.toLowerCase(Locale.ROOT);
            }
            if (transformations.isCurrencyToNumber()) {
                value = ExtractedValueParser.cleanAmount(value);
            }
            if (transformations.isParseFloat()) {
                value = ExtractedValueParser.parseAmount(value).map(BigDecimal::toPlainString).orElse(null);
            } else if (transformations.isParseInt()) {
                value = ExtractedValueParser.parseAmount(value)
                                            .map(number -> number.setScale(0, RoundingMode.DOWN).toPlainString())
                                            .orElse(null);
            }
            if (transformations.isReformatDate() && value != null) {
                final String current = value;
                value = ExtractedValueParser.parseDate(current).map(Object::toString).orElse(current);
            }
        }
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty()).orElse(null);
    }
}
