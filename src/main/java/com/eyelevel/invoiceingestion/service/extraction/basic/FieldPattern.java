package com.eyelevel.invoiceingestion.service.extraction.basic;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A capture pattern paired with the check its first group must pass to count as a match.
 */
record FieldPattern(Pattern pattern, Predicate<String> validator) {

    static FieldPattern of(final String regex, final Predicate<String> validator) {
        return new FieldPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), validator);
    }

    static FieldPattern of(final String regex) {
        return of(regex, value -> true);
    }

    Optional<String> firstMatch(final String text) {
        final Matcher matcher = pattern.matcher(text);
        if (matcher.find() && matcher.group(1) != null) {
            final String value = matcher.group(1).trim();
            if (validator.test(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    Optional<String> lastMatch(final String text) {
        final Matcher matcher = pattern.matcher(text);
        String last = null;
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                last = matcher.group(1).trim();
            }
        }
        return Optional.ofNullable(last).filter(validator);
    }
}
