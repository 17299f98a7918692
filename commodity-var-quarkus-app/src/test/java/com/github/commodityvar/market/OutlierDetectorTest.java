package com.github.commodityvar.market;

import com.github.commodityvar.TestData;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.commodityvar.TestData.*;
import static org.assertj.core.api.Assertions.*;

class OutlierDetectorTest {

    private final OutlierDetector detector = new OutlierDetector();

    @Test
    void flagsQuoteTenDeviationsAboveMean() {
        // 100/102 alternating: mean 101, population std 1
        List<PriceQuote> quotes = new ArrayList<>(dailySeries(COPPER_OCT, 50, i -> i % 2 == 0 ? 100.0 : 102.0));
        PriceQuote spike = quote(COPPER_OCT, START.plusDays(50), 101.0 + 10 * 1.0);
        quotes.add(spike);

        OutlierReport report = detector.detect(quotes);

        assertThat(report.outlierCount()).isEqualTo(1);
        assertThat(report.outliers()).singleElement().satisfies(flagged -> {
            assertThat(flagged.quote()).isSameAs(spike);
            assertThat(flagged.zScore()).isGreaterThan(4.0);
        });
    }

    @Test
    void zeroVarianceGroupsFlagNothing() {
        List<PriceQuote> quotes = TestData.concat(
                dailySeries(COPPER_OCT, 20, i -> 9000.0),
                dailySeries(ZINC_OCT, 20, i -> 2600.0));

        OutlierReport report = detector.detect(quotes);

        assertThat(report.outlierCount()).isZero();
        assertThat(report.outliers()).isEmpty();
    }

    @Test
    void singleObservationGroupFlagsNothing() {
        OutlierReport report = detector.detect(List.of(quote(LEAD_DEC, START, 2000.0)));

        assertThat(report.outlierCount()).isZero();
    }

    @Test
    void scoresEachInstrumentAgainstItsOwnGroup() {
        // Zinc trades far below copper, which is not an outlier within its own group
        List<PriceQuote> quotes = TestData.concat(
                dailySeries(COPPER_OCT, 30, i -> 9000.0 + (i % 3)),
                dailySeries(ZINC_OCT, 30, i -> 2600.0 + (i % 3)));

        assertThat(detector.detect(quotes).outlierCount()).isZero();
    }

    @Test
    void lowerThresholdFlagsMore() {
        List<PriceQuote> quotes = new ArrayList<>(dailySeries(COPPER_OCT, 20, i -> i % 2 == 0 ? 100.0 : 102.0));
        quotes.add(quote(COPPER_OCT, START.plusDays(20), 106.0));

        assertThat(new OutlierDetector(4.0).detect(quotes).outlierCount()).isZero();
        assertThat(new OutlierDetector(2.0).detect(quotes).outlierCount()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new OutlierDetector(0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
