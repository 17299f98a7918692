package com.github.commodityvar.risk;

import com.github.commodityvar.TestData;
import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.commodityvar.TestData.*;
import static org.assertj.core.api.Assertions.*;

class TimeSeriesReconstructorTest {

    private final TimeSeriesReconstructor reconstructor = new TimeSeriesReconstructor(365);

    @Test
    void valuesEachDateWithThatDaysQuotes() {
        List<Position> positions = List.of(longPosition(COPPER_OCT, 10), shortPosition(ZINC_OCT, 20));
        List<PriceQuote> quotes = TestData.concat(
                dailySeries(COPPER_OCT, 3, i -> 9000.0 + 100 * i),
                dailySeries(ZINC_OCT, 3, i -> 2500.0 + 10 * i));

        PortfolioValueSeries series = reconstructor.reconstruct(positions, quotes);

        assertThat(series.dates()).containsExactly(START, START.plusDays(1), START.plusDays(2));
        assertThat(series.values()).containsExactly(
                10 * 9000.0 - 20 * 2500.0,
                10 * 9100.0 - 20 * 2510.0,
                10 * 9200.0 - 20 * 2520.0);
    }

    @Test
    void dropsDatesWithAnyMissingQuote() {
        List<Position> positions = List.of(longPosition(COPPER_OCT, 10), longPosition(ZINC_OCT, 20));
        List<PriceQuote> zinc = new ArrayList<>(dailySeries(ZINC_OCT, 5, i -> 2500.0));
        zinc.remove(2);

        PortfolioValueSeries series = reconstructor.reconstruct(positions,
                TestData.concat(dailySeries(COPPER_OCT, 5, i -> 9000.0), zinc));

        assertThat(series.dates()).containsExactly(START, START.plusDays(1), START.plusDays(3), START.plusDays(4));
        assertThat(series.values()).containsOnly(10 * 9000.0 + 20 * 2500.0);
    }

    @Test
    void positionWithoutAnyQuoteLeavesAnEmptySeries() {
        List<Position> positions = List.of(longPosition(COPPER_OCT, 10), longPosition(LEAD_DEC, 5));

        PortfolioValueSeries series = reconstructor.reconstruct(positions, copperTrend());

        assertThat(series.isEmpty()).isTrue();
    }

    @Test
    void restrictsToLookbackWindow() {
        PortfolioValueSeries series = new TimeSeriesReconstructor(7)
                .reconstruct(List.of(longPosition(COPPER_OCT, 1)), copperTrend());

        assertThat(series.size()).isEqualTo(8);
        assertThat(series.dates().get(0)).isEqualTo(START.plusDays(22));
    }

    @Test
    void dailyChangesAreAbsoluteDifferences() {
        PortfolioValueSeries series = new PortfolioValueSeries(List.of(
                new PortfolioValueSeries.Point(START.plusDays(1), 110.0),
                new PortfolioValueSeries.Point(START, 100.0),
                new PortfolioValueSeries.Point(START.plusDays(2), 99.0)));

        assertThat(series.dailyChanges()).containsExactly(10.0, -11.0);
    }
}
