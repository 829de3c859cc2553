package com.eyelevel.invoiceingestion.service.extraction.pdf;

import java.util.List;

/**
 * All text primitives of one page together with the page's media box size.
 */
public record PageLayout(float width, float height, List<TextPrimitive> primitives) {

    public PageLayout {
        primitives = List.copyOf(primitives);
    }
}
