package com.eyelevel.invoiceingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DocumentType {
    INVOICE("invoice", "INV"),
    CREDIT_NOTE("credit_note", "CN"),
    STATEMENT("statement", "STMT");

    private final String tag;
    private final String numberPrefix;

    DocumentType(String tag, String numberPrefix) {
        this.tag = tag;
        this.numberPrefix = numberPrefix;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Prefix of the placeholder number generated when a document carries no number of its own.
     */
    public String getNumberPrefix() {
        return numberPrefix;
    }

    @JsonCreator
    public static DocumentType fromTag(String value) {
        return Arrays.stream(values())
                     .filter(type -> type.tag.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Unknown document type: " + value));
    }
}
