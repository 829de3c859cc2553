package com.eyelevel.invoiceingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-processing applied to a raw field value, in declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldTransformations {

    @Builder.Default
    private List<String> remove = new ArrayList<>();

    private boolean trim;
    private boolean uppercase;
    private boolean lowercase;
    private boolean parseFloat;
    private boolean parseInt;
    private boolean currencyToNumber;

    /**
     * Re-parse the value as a date and emit it as ISO {@code yyyy-MM-dd}.
     */
    private boolean reformatDate;
}
