package com.eyelevel.invoiceingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data-quality outcomes recorded on a document instead of raising an exception.
 */
public enum FailureReason {
    NO_COMPANY_MATCH("no_company_match"),
    UNALLOCATED("unallocated"),
    PARSING_ERROR("parsing_error"),
    DUPLICATE("duplicate"),
    MISSING_FIELDS("missing_fields"),
    NO_TEMPLATE("no_template"),
    OTHER("other");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
