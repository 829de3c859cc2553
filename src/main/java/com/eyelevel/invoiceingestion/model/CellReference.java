package com.eyelevel.invoiceingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A spreadsheet cell such as {@code column = "B", row = 4}. When {@code sheet} is empty the first sheet is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellReference {

    private String column;
    private int row;
    private String sheet;

    public boolean isWellFormed() {
        return column != null && column.matches("[A-Za-z]{1,3}") && row >= 1;
    }
}
