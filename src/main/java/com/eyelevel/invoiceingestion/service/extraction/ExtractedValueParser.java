package com.eyelevel.invoiceingestion.service.extraction;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the loosely formatted dates and amounts found on invoices.
 */
public final class ExtractedValueParser {

    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{4}|\\d{2})$");
    private static final Pattern YEAR_FIRST = Pattern.compile("^(\\d{4})[/\\-](\\d{1,2})[/\\-](\\d{1,2})$");
    private static final Pattern DAY_MONTH_NAME = Pattern.compile("^(\\d{1,2})\\s+([A-Za-z]{3,9})\\.?,?\\s+(\\d{4}|\\d{2})$");
    private static final Pattern MONTH_NAME_DAY = Pattern.compile("^([A-Za-z]{3,9})\\.?\\s+(\\d{1,2}),?\\s+(\\d{4}|\\d{2})$");
    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private ExtractedValueParser() {
    }

    /**
     * Accepts {@code dd/MM/yy[yy]}, {@code dd-MM-yy[yy]}, {@code dd.MM.yy[yy]}, {@code yyyy-MM-dd},
     * {@code yyyy/MM/dd}, {@code d MMM yyyy} and {@code MMM d, yyyy}. Two-digit years below 50 are 20xx.
     */
    public static Optional<LocalDate> parseDate(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final String text = value.trim();
        try {
            final Matcher dayFirst = DAY_FIRST.matcher(text);
            if (dayFirst.matches()) {
                return Optional.of(LocalDate.of(year(dayFirst.group(3)), Integer.parseInt(dayFirst.group(2)),
                                                Integer.parseInt(dayFirst.group(1))));
            }
            final Matcher yearFirst = YEAR_FIRST.matcher(text);
            if (yearFirst.matches()) {
                return Optional.of(LocalDate.of(Integer.parseInt(yearFirst.group(1)),
                                                Integer.parseInt(yearFirst.group(2)),
                                                Integer.parseInt(yearFirst.group(3))));
            }
            final Matcher dayMonth = DAY_MONTH_NAME.matcher(text);
            if (dayMonth.matches()) {
                return month(dayMonth.group(2)).map(month -> LocalDate.of(year(dayMonth.group(3)), month,
                                                                          Integer.parseInt(dayMonth.group(1))));
            }
            final Matcher monthDay = MONTH_NAME_DAY.matcher(text);
            if (monthDay.matches()) {
                return month(monthDay.group(1)).map(month -> LocalDate.of(year(monthDay.group(3)), month,
                                                                          Integer.parseInt(monthDay.group(2))));
            }
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Strips currency symbols, thousands separators, whitespace and any other character that is not a
     * digit, a dot or a minus sign.
     */
    public static String cleanAmount(final String value) {
        if (value == null) {
            return null;
        }
        return value.replaceAll("[£$€¥₹,\\s]", "").replaceAll("[^0-9.\\-]", "");
    }

    public static Optional<BigDecimal> parseAmount(final String value) {
        final String cleaned = cleanAmount(value);
        if (cleaned == null || !NUMERIC.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(cleaned));
    }

    private static int year(final String digits) {
        final int year = Integer.parseInt(digits);
        if (digits.length() == 2) {
            return year < 50 ? 2000 + year : 1900 + year;
        }
        return year;
    }

    private static Optional<Integer> month(final String name) {
        if (name.length() < 3) {
            return Optional.empty();
        }
        return Optional.ofNullable(MONTHS.get(name.substring(0, 3).toLowerCase(Locale.ROOT)));
    }
}
