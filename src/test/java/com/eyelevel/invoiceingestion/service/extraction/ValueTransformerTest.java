package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.FieldTransformations;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValueTransformerTest {

    @Test
    void appliesTransformationsInOrder() {
        final FieldTransformations transformations = FieldTransformations.builder()
                                                                         .remove(List.of("Ref:"))
                                                                         .trim(true)
                                                                         .uppercase(true)
                                                                         .build();

        assertThat(ValueTransformer.apply("Ref:  inv-77 ", transformations)).isEqualTo("INV-77");
    }

    @Test
    void parseIntTruncatesAndUnparseableBecomesNull() {
        final FieldTransformations parseInt = FieldTransformations.builder().parseInt(true).build();

        assertThat(ValueTransformer.apply("£1,299.99", parseInt)).isEqualTo("1299");
        assertThat(ValueTransformer.apply("none", parseInt)).isNull();
    }

    @Test
    void reformatDateKeepsOriginalWhenUnparseable() {
        final FieldTransformations reformat = FieldTransformations.builder().reformatDate(true).build();

        assertThat(ValueTransformer.apply("3 Jan 2025", reformat)).isEqualTo("2025-01-03");
        assertThat(ValueTransformer.apply("Q1 2025", reformat)).isEqualTo("Q1 2025");
    }

    @Test
    void withoutTransformationsOnlyBlankIsDropped() {
        assertThat(ValueTransformer.apply(" A1 ", null)).isEqualTo("A1");
        assertThat(ValueTransformer.apply("   ", null)).isNull();
    }
}
