package com.github.commodityvar.portfolio;

import org.junit.jupiter.api.Test;

import static com.github.commodityvar.TestData.*;
import static org.assertj.core.api.Assertions.*;

class BreakdownDimensionTest {

    @Test
    void resolvesSnapshotColumnLabels() {
        assertThat(BreakdownDimension.fromLabel("BUSINESS LINE")).hasValue(BreakdownDimension.BUSINESS_LINE);
        assertThat(BreakdownDimension.fromLabel("business_line")).hasValue(BreakdownDimension.BUSINESS_LINE);
        assertThat(BreakdownDimension.fromLabel("Metal")).hasValue(BreakdownDimension.METAL);
        assertThat(BreakdownDimension.fromLabel("Total")).hasValue(BreakdownDimension.TOTAL);
        assertThat(BreakdownDimension.fromLabel("CONTRACTTYPE")).hasValue(BreakdownDimension.CONTRACT_TYPE);
    }

    @Test
    void unknownLabelIsEmpty() {
        assertThat(BreakdownDimension.fromLabel("DESK")).isEmpty();
        assertThat(BreakdownDimension.fromLabel(null)).isEmpty();
    }

    @Test
    void extractsPartitionValues() {
        Position position = position(COPPER_OCT, "Prop", 10);

        assertThat(BreakdownDimension.BUSINESS_LINE.partitionOf(position)).isEqualTo("Prop");
        assertThat(BreakdownDimension.METAL.partitionOf(position)).isEqualTo("Copper");
        assertThat(BreakdownDimension.MATURITY.partitionOf(position)).isEqualTo("Oct-2024");
        assertThat(BreakdownDimension.TOTAL.partitionOf(position)).isEqualTo("Total").isEqualTo(BreakdownDimension.TOTAL_PARTITION);
    }
}
