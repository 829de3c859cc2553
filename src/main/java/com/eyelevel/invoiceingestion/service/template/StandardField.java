package com.eyelevel.invoiceingestion.service.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The canonical business fields, declared in parsing order. Template field names are mapped onto these
 * through {@link #canonicalName(String)}; anything unknown is kept as a custom field.
 */
public enum StandardField {
    SUPPLIER_NAME("supplierName", false, "supplier_name", "vendor_name", "vendor", "supplier"),
    DOCUMENT_TYPE("documentType", false, "document_type", "documenttype", "doc_type", "type"),
    ACCOUNT_NUMBER("accountNumber", true, "account_number", "account_no", "accountno", "customer_number",
                   "customer_no", "account", "supplier_code", "vendor_code"),
    INVOICE_DATE("invoiceDate", true, "date", "invoice_date", "tax_point", "taxpoint", "date_tax_point",
                 "tax_point_date"),
    INVOICE_NUMBER("invoiceNumber", false, "invoice_number", "invoice_no", "invoicenumber", "inv_no",
                   "invoice_ref"),
    CREDIT_NUMBER("creditNumber", false, "credit_number", "credit_no", "creditnumber", "credit_note_number",
                  "credit_ref", "creditnotenumber"),
    CUSTOMER_PO("customerPO", false, "customer_po", "customerpo", "po_number", "po_no", "purchase_order", "po"),
    TOTAL_AMOUNT("totalAmount", false, "total", "amount", "invoice_total", "invoicetotal", "total_amount",
                 "grand_total"),
    VAT_AMOUNT("vatAmount", false, "vat_amount", "vat_total", "vatamount", "tax_amount", "tax"),
    GOODS_AMOUNT("goodsAmount", false, "goods_amount", "goods", "goodsamount", "subtotal", "net_amount"),
    CUSTOMER_NAME("customerName", false, "customer_name", "customername", "company_name", "company"),
    INVOICE_TO("invoiceTo", false, "invoice_to", "invoiceto", "bill_to", "billto"),
    DELIVERY_ADDRESS("deliveryAddress", false, "delivery_address", "deliveryaddress", "ship_to", "shipto",
                     "shipping_address");

    private static final Map<String, StandardField> BY_ALIAS = Arrays.stream(values())
            .flatMap(field -> Stream.concat(Stream.of(normalize(field.standardName)), field.aliases.stream())
                                    .map(alias -> Map.entry(alias, field)))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (first, second) -> first));

    private final String standardName;
    private final boolean crucial;
    private final List<String> aliases;

    StandardField(String standardName, boolean crucial, String... aliases) {
        this.standardName = standardName;
        this.crucial = crucial;
        this.aliases = List.of(aliases);
    }

    public String getStandardName() {
        return standardName;
    }

    /**
     * Crucial fields are extracted first; a template that defines one but yields no value stops extraction.
     */
    public boolean isCrucial() {
        return crucial;
    }

    public static Optional<StandardField> fromName(final String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(normalize(fieldName)));
    }

    /**
     * @return the standard name for a known alias, otherwise the trimmed input unchanged
     */
    public static String canonicalName(final String fieldName) {
        return fromName(fieldName).map(StandardField::getStandardName)
                                  .orElse(fieldName == null ? null : fieldName.trim());
    }

    /**
     * Orders template field names so that crucial fields come first, then the remaining standard fields in
     * declaration order, then custom fields as given.
     */
    public static List<String> inParsingOrder(final Iterable<String> fieldNames) {
        final Function<String, Integer> rank = name -> fromName(name)
                .map(field -> field.crucial ? field.ordinal() : values().length + field.ordinal())
                .orElse(2 * values().length);
        final List<String> names = new ArrayList<>();
        fieldNames.forEach(names::add);
        names.sort(Comparator.comparing(rank));
        return names;
    }

    private static String normalize(final String fieldName) {
        String normalized = fieldName.trim().toLowerCase(Locale.ROOT);
        while (normalized.endsWith(".") || normalized.endsWith(":")) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized.replaceAll("[\\s-]+", "_");
    }
}
