package com.eyelevel.invoiceingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A rectangular page region expressed as fractions (0 to 1) of the page width and height, with the
 * origin at the top-left corner of the page. Pages are numbered from 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRegion {

    private double left;
    private double top;
    private double right;
    private double bottom;

    @Builder.Default
    private int page = 1;

    /**
     * Read the region from the last page of multi-page documents (typically totals).
     */
    private boolean lastPage;

    public boolean isWellFormed() {
        return left >= 0 && right <= 1 && left < right
               && top >= 0 && bottom <= 1 && top < bottom
               && page >= 1;
    }
}
