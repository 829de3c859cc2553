package com.eyelevel.invoiceingestion.service.extraction.pdf;

import com.eyelevel.invoiceingestion.model.TemplateRegion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the text inside a template region. Pure geometry: the same layout and region always give the same
 * string.
 */
public final class RegionSelector {

    /**
     * Primitives whose normalised Y differ by at most this much are treated as one line.
     */
    static final double LINE_TOLERANCE = 0.01;

    private RegionSelector() {
    }

    public static String select(final PageLayout layout, final TemplateRegion region) {
        if (layout.width() <= 0 || layout.height() <= 0) {
            return "";
        }
        final List<Normalized> hits = new ArrayList<>();
        for (TextPrimitive primitive : layout.primitives()) {
            final double normX = primitive.x() / layout.width();
            final double normY = 1 - primitive.y() / layout.height();
            if (normX >= region.getLeft() && normX <= region.getRight()
                && normY >= region.getTop() && normY <= region.getBottom()) {
                hits.add(new Normalized(primitive.text(), normX, normY));
            }
        }
        hits.sort(Comparator.comparingDouble(Normalized::y)
                            .thenComparingDouble(Normalized::x)
                            .thenComparing(Normalized::text));

        final List<List<Normalized>> lines = new ArrayList<>();
        double lineY = Double.NaN;
        for (Normalized hit : hits) {
            if (lines.isEmpty() || Math.abs(hit.y() - lineY) > LINE_TOLERANCE) {
                lines.add(new ArrayList<>());
                lineY = hit.y();
            }
            lines.get(lines.size() - 1).add(hit);
        }

        return lines.stream()
                    .flatMap(line -> line.stream()
                                         .sorted(Comparator.comparingDouble(Normalized::x)
                                                           .thenComparing(Normalized::text)))
                    .map(Normalized::text)
                    .map(String::trim)
                    .filter(text -> !text.isEmpty())
                    .collect(Collectors.joining(" "))
                    .trim();
    }

    private record Normalized(String text, double x, double y) {
    }
}
