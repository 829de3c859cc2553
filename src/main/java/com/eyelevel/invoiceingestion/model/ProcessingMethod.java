package com.eyelevel.invoiceingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the fields of an extraction result were obtained. Each method carries the base quality used when no
 * provider-reported confidence is available.
 */
public enum ProcessingMethod {
    LOCAL_COORDINATES("local_coordinates", 0.80),
    SPREADSHEET_CELLS("spreadsheet_cells", 0.80),
    BASIC_REGEX("local_basic", 0.70),
    VISION("vision", 0.85),
    DOCUMENT_AI("document_ai", 0.90);

    private final String tag;
    private final double defaultBaseQuality;

    ProcessingMethod(String tag, double defaultBaseQuality) {
        this.tag = tag;
        this.defaultBaseQuality = defaultBaseQuality;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public double getDefaultBaseQuality() {
        return defaultBaseQuality;
    }
}
