package com.eyelevel.invoiceingestion.service.classify;

import com.eyelevel.invoiceingestion.model.DocumentType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tags a document as invoice, credit note or statement from its raw text using ordered keyword rules.
 * <p>
 * Credit-note markers are checked before "invoice" because credit notes commonly quote the invoice they
 * reverse. Anything unrecognised is an invoice, the dominant type.
 */
@Component
public class DocumentClassifier {

    private static final Pattern CN_TOKEN = Pattern.compile("\\bCN\\b");

    public DocumentType classify(final String text) {
        if (text == null || text.isBlank()) {
            return DocumentType.INVOICE;
        }
        final String upper = text.toUpperCase(Locale.ROOT);

        if (upper.contains("CREDIT NOTE") || upper.contains("CREDITNOTE")) {
            return DocumentType.CREDIT_NOTE;
        }
        if (upper.contains("STATEMENT")) {
            return DocumentType.STATEMENT;
        }
        if (upper.contains("INVOICE")) {
            return DocumentType.INVOICE;
        }
        if (upper.contains("CREDIT")) {
            return upper.contains("NOTE") || CN_TOKEN.matcher(upper).find()
                    ? DocumentType.CREDIT_NOTE
                    : DocumentType.INVOICE;
        }
        return DocumentType.INVOICE;
    }
}
