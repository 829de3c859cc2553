package com.eyelevel.invoiceingestion.service.extraction.pdf;

/**
 * One run of text on a page. Coordinates are in PDF points with the origin at the bottom-left corner.
 */
public record TextPrimitive(String text, float x, float y) {
}
