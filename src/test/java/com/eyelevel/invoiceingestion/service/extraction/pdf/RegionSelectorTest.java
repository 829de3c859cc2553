package com.eyelevel.invoiceingestion.service.extraction.pdf;

import com.eyelevel.invoiceingestion.model.TemplateRegion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegionSelectorTest {

    // 1000 x 1000 page so normalised coordinates read directly off the points
    private static final float SIZE = 1000f;

    @Test
    void joinsWordsInReadingOrderInsideRegion() {
        final PageLayout layout = new PageLayout(SIZE, SIZE, List.of(
                new TextPrimitive("Street", 300, 795),
                new TextPrimitive("High", 200, 796),
                new TextPrimitive("London", 200, 750),
                new TextPrimitive("outside", 800, 796)));
        final TemplateRegion region = region(0.1, 0.15, 0.5, 0.3);

        assertThat(RegionSelector.select(layout, region)).isEqualTo("High Street London");
    }

    @Test
    void boundaryPointsAreInclusive() {
        // 1024-point page keeps the normalised coordinates exact
        final PageLayout layout = new PageLayout(1024, 1024, List.of(new TextPrimitive("edge", 128, 896)));

        assertThat(RegionSelector.select(layout, region(0.125, 0.125, 0.25, 0.25))).isEqualTo("edge");
    }

    @Test
    void sameInputGivesSameOutputRegardlessOfPrimitiveOrder() {
        final TextPrimitive a = new TextPrimitive("A", 100, 500);
        final TextPrimitive b = new TextPrimitive("B", 100, 500);
        final TemplateRegion region = region(0, 0, 1, 1);

        final String forward = RegionSelector.select(new PageLayout(SIZE, SIZE, List.of(a, b)), region);
        final String reversed = RegionSelector.select(new PageLayout(SIZE, SIZE, List.of(b, a)), region);

        assertThat(forward).isEqualTo(reversed).isEqualTo("A B");
    }

    @Test
    void emptyRegionAndDegeneratePageGiveEmptyString() {
        final PageLayout layout = new PageLayout(SIZE, SIZE, List.of(new TextPrimitive("x", 900, 100)));

        assertThat(RegionSelector.select(layout, region(0, 0, 0.5, 0.5))).isEmpty();
        assertThat(RegionSelector.select(new PageLayout(0, 0, layout.primitives()), region(0, 0, 1, 1))).isEmpty();
    }

    private static TemplateRegion region(double left, double top, double right, double bottom) {
        return TemplateRegion.builder().left(left).top(top).right(right).bottom(bottom).build();
    }
}
