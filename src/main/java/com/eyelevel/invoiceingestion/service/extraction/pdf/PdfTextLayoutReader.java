package com.eyelevel.invoiceingestion.service.extraction.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the position of every word PDFBox emits for a page instead of the plain text.
 * <p>
 * Instances hold per-page state and are not reusable; use {@link #readPage(PDDocument, int)}.
 */
public final class PdfTextLayoutReader extends PDFTextStripper {

    private final List<TextPrimitive> primitives = new ArrayList<>();

    private PdfTextLayoutReader() {
        setSortByPosition(true);
    }

    /**
     * @param pageNumber 1-based page number
     */
    public static PageLayout readPage(final PDDocument document, final int pageNumber) throws IOException {
        final PdfTextLayoutReader reader = new PdfTextLayoutReader();
        reader.setStartPage(pageNumber);
        reader.setEndPage(pageNumber);
        reader.writeText(document, Writer.nullWriter());
        final PDRectangle mediaBox = document.getPage(pageNumber - 1).getMediaBox();
        return new PageLayout(mediaBox.getWidth(), mediaBox.getHeight(), reader.primitives);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (text == null || text.isBlank() || textPositions.isEmpty()) {
            return;
        }
        final TextPosition first = textPositions.get(0);
        final float pageHeight = getCurrentPage().getMediaBox().getHeight();
        // yDirAdj grows downwards from the top edge
        primitives.add(new TextPrimitive(text, first.getXDirAdj(), pageHeight - first.getYDirAdj()));
    }
}
