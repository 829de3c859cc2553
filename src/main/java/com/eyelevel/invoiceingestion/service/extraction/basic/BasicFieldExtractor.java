package com.eyelevel.invoiceingestion.service.extraction.basic;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.service.extraction.ExtractedValueParser;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template-free extraction over raw document text. Each field has an ordered list of patterns; the first
 * match that passes the field's validator wins.
 */
@Slf4j
@Component
public class BasicFieldExtractor {

    private static final Pattern PLACEHOLDER_WORD = Pattern.compile("^(no|yes|na|n/a)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PO_NOISE =
            Pattern.compile("^(no|yes|na|n/a|order|date|packing|list|number)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_DATE = Pattern.compile("^\\d{1,2}[/\\-]\\d{1,2}");
    private static final Pattern ACCOUNT_TOKEN = Pattern.compile("\\b([A-Z0-9]{4,20})\\b");
    private static final String AMOUNT = "[£$€]?\\s*([\\d,]+\\.?\\d{2})";

    private static final Predicate<String> INVOICE_NUMBER_VALID = lengthBetween(4, 50).and(notPlaceholder());
    private static final Predicate<String> ACCOUNT_NUMBER_VALID = lengthBetween(4, 20).and(notPlaceholder());
    private static final Predicate<String> AMOUNT_VALID = value -> ExtractedValueParser.parseAmount(value).isPresent();

    private static final List<FieldPattern> INVOICE_NUMBER = List.of(
            FieldPattern.of("invoice\\s+no\\.?\\s+:?\\s*(\\d{4,}[A-Z0-9\\-_]*)", INVOICE_NUMBER_VALID),
            FieldPattern.of("invoice\\s*#\\s*:?\\s*([A-Z0-9\\-_]+)", INVOICE_NUMBER_VALID),
            FieldPattern.of("invoice\\s+number\\s*:?\\s*([A-Z0-9\\-_]+)", INVOICE_NUMBER_VALID),
            FieldPattern.of("(?:^|\\s)(INV[-\\s]?[A-Z0-9\\-_]+)", INVOICE_NUMBER_VALID),
            FieldPattern.of("(?:^|\\s)([A-Z]{2,}[-\\s_]?INV[-\\s_]?\\d+[A-Z0-9\\-_]*)", INVOICE_NUMBER_VALID),
            FieldPattern.of("invoice\\s+([A-Z0-9\\-_]+)", INVOICE_NUMBER_VALID),
            FieldPattern.of("(?:^|\\s)(\\d{7,}[A-Z0-9\\-_]*)", INVOICE_NUMBER_VALID));

    private static final List<FieldPattern> INVOICE_DATE = List.of(
            FieldPattern.of("(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4})"),
            FieldPattern.of("(\\d{4}[/\\-]\\d{1,2}[/\\-]\\d{1,2})"),
            FieldPattern.of("(\\d{1,2}\\s+(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\s+\\d{2,4})"),
            FieldPattern.of("((?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\s+\\d{1,2},?\\s+\\d{2,4})"));

    private static final List<FieldPattern> TOTAL_AMOUNT = List.of(
            FieldPattern.of("invoice\\s+total\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("(?:^|\\s)total\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("(?:amount\\s+due|balance\\s+due|grand\\s+total)\\s*:?\\s*" + AMOUNT, AMOUNT_VALID));

    private static final FieldPattern LAST_CURRENCY_AMOUNT = FieldPattern.of("[£$€]\\s*([\\d,]+\\.?\\d{2})", AMOUNT_VALID);

    private static final List<FieldPattern> ACCOUNT_NUMBER = List.of(
            FieldPattern.of("account\\s+no\\.?\\s*:?\\s*(\\d{4,}[A-Z0-9\\-]*)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("account\\s*#\\s*:?\\s*([A-Z0-9\\-]+)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("account\\s+number\\s*:?\\s*([A-Z0-9\\-]+)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("acc\\s+no\\.?\\s*:?\\s*(\\d{4,}[A-Z0-9\\-]*)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("account\\s+code\\s*:?\\s*([A-Z0-9\\-]+)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("customer\\s+account\\s*:?\\s*([A-Z0-9\\-]+)", ACCOUNT_NUMBER_VALID),
            FieldPattern.of("account\\s+id\\s*:?\\s*([A-Z0-9\\-]+)", ACCOUNT_NUMBER_VALID));

    private static final List<FieldPattern> CUSTOMER_NAME = List.of(
            FieldPattern.of("(?:bill\\s*to|customer|client)[\\s:]*\\n?([A-Z][A-Za-z\\s&,.\\-']+)"),
            FieldPattern.of("(?:sold\\s*to)[\\s:]*\\n?([A-Z][A-Za-z\\s&,.\\-']+)"));

    private static final Predicate<String> PO_VALID =
            lengthBetween(2, 50).and(value -> !PLACEHOLDER_WORD.matcher(value).matches());

    private static final List<FieldPattern> CUSTOMER_PO = List.of(
            FieldPattern.of("customer\\s+po\\s*:?\\s*([A-Z0-9\\s\\-_]{2,50})", PO_VALID),
            FieldPattern.of("\\bpo\\s+(?:number\\s*)?:?\\s*([A-Z0-9\\s\\-_]{2,50})", PO_VALID),
            FieldPattern.of("purchase\\s+order\\s*:?\\s*([A-Z0-9\\s\\-_]{2,50})", PO_VALID),
            FieldPattern.of("\\bpo\\s*#\\s*:?\\s*([A-Z0-9\\s\\-_]{2,50})", PO_VALID));

    private static final List<FieldPattern> VAT_AMOUNT = List.of(
            FieldPattern.of("vat\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("vat\\s+amount\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("tax\\s+amount\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("tax\\s*:?\\s*" + AMOUNT, AMOUNT_VALID));

    private static final List<FieldPattern> GOODS_AMOUNT = List.of(
            FieldPattern.of("goods\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("net\\s+amount\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("subtotal\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("goods\\s+value\\s*:?\\s*" + AMOUNT, AMOUNT_VALID),
            FieldPattern.of("goods\\s*:?\\s*[£$€]?\\s*([\\d,]+\\.?\\d*)", AMOUNT_VALID));

    public ExtractionResult extract(final String text, final DocumentType documentType) {
        final String source = text == null ? "" : text;
        final Map<String, String> fields = new LinkedHashMap<>();

        accountNumber(source).ifPresent(value -> fields.put("accountNumber", value));
        firstOf(INVOICE_DATE, source).ifPresent(value -> fields.put("invoiceDate", value));
        firstOf(INVOICE_NUMBER, source).ifPresent(value -> fields.put("invoiceNumber", value));
        customerPo(source).ifPresent(value -> fields.put("customerPO", value));
        totalAmount(source).ifPresent(value -> fields.put("totalAmount", ExtractedValueParser.cleanAmount(value)));
        firstOf(VAT_AMOUNT, source).ifPresent(value -> fields.put("vatAmount", ExtractedValueParser.cleanAmount(value)));
        firstOf(GOODS_AMOUNT, source).ifPresent(value -> fields.put("goodsAmount", ExtractedValueParser.cleanAmount(value)));
        firstOf(CUSTOMER_NAME, source).map(name -> name.split("\\n")[0].trim())
                                      .filter(name -> !name.isEmpty())
                                      .ifPresent(value -> fields.put("customerName", value));

        log.debug("Basic extraction found {} field(s): {}", fields.size(), fields.keySet());
        return new ExtractionResult(fields, source, ProcessingMethod.BASIC_REGEX, List.of(),
                                    null, documentType);
    }

    Optional<String> totalAmount(final String text) {
        return firstOf(TOTAL_AMOUNT, text).or(() -> LAST_CURRENCY_AMOUNT.lastMatch(text));
    }

    /**
     * Customer account numbers sit near the top of the document; anything after "bank details" is the
     * supplier's own bank account and is ignored.
     */
    Optional<String> accountNumber(final String text) {
        final int bankSection = text.toLowerCase(Locale.ROOT).indexOf("bank details");
        final String beforeBank = bankSection > 0 ? text.substring(0, bankSection) : text;

        final Optional<String> labelled = firstOf(ACCOUNT_NUMBER, beforeBank);
        if (labelled.isPresent()) {
            return labelled;
        }
        return Arrays.stream(beforeBank.split("\\n"))
                     .limit(20)
                     .filter(line -> {
                         final String lower = line.toLowerCase(Locale.ROOT);
                         return (lower.contains("account") || lower.contains("acc")) && !lower.contains("bank");
                     })
                     .map(ACCOUNT_TOKEN::matcher)
                     .filter(Matcher::find)
                     .map(matcher -> matcher.group(1))
                     .findFirst();
    }

    Optional<String> customerPo(final String text) {
        final Optional<String> sameLine = firstOf(CUSTOMER_PO, text);
        if (sameLine.isPresent()) {
            return sameLine;
        }
        final Matcher label = Pattern.compile("customer\\s+po\\s*:?\\s*", Pattern.CASE_INSENSITIVE).matcher(text);
        if (!label.find()) {
            return Optional.empty();
        }
        final String after = text.substring(label.end(), Math.min(text.length(), label.end() + 200));
        final Matcher value = Pattern.compile("\\b([A-Z0-9\\s\\-_]{2,50})\\b", Pattern.CASE_INSENSITIVE).matcher(after);
        if (value.find()) {
            final String po = value.group(1).trim();
            if (po.length() >= 2 && !PO_NOISE.matcher(po).matches() && !LEADING_DATE.matcher(po).find()) {
                return Optional.of(po);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstOf(final List<FieldPattern> patterns, final String text) {
        for (FieldPattern pattern : patterns) {
            final Optional<String> match = pattern.firstMatch(text);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private static Predicate<String> lengthBetween(final int min, final int max) {
        return value -> value.length() >= min && value.length() <= max;
    }

    private static Predicate<String> notPlaceholder() {
        return value -> !PLACEHOLDER_WORD.matcher(value).matches();
    }
}
