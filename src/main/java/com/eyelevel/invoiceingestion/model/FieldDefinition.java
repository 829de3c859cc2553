package com.eyelevel.invoiceingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where to read one field from. PDF templates set {@code region}, spreadsheet templates set {@code cell}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition {

    private TemplateRegion region;
    private CellReference cell;
    private FieldTransformations transformations;
}
