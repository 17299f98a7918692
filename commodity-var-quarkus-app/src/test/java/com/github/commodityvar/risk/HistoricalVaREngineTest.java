package com.github.commodityvar.risk;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.commodityvar.TestData.START;
import static org.assertj.core.api.Assertions.*;

class HistoricalVaREngineTest {

    private final HistoricalVaREngine engine = new HistoricalVaREngine();

    @Test
    void constantValueSeriesHasZeroVaR() throws Exception {
        assertThat(engine.valueAtRisk(series(5_000.0, 5_000.0, 5_000.0, 5_000.0), 0.99)).isEqualTo(0.0);
    }

    @Test
    void isNegatedLowerQuantileOfDailyPnl() throws Exception {
        // changes: -10, +20, -30, +5, -5
        PortfolioValueSeries series = series(100, 90, 110, 80, 85, 80);

        // sorted -30,-10,-5,5,20; 5% quantile at rank 0.2 -> -30 + 0.2 * 20 = -26
        assertThat(engine.valueAtRisk(series, 0.95)).isCloseTo(26.0, within(1e-9));
        // 50% is the median change
        assertThat(engine.valueAtRisk(series, 0.5)).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void onlyGainsGiveNegativeVaR() throws Exception {
        // changes 10, 20, 30; 5% quantile at rank 0.1 -> 10 + 0.1 * 10 = 11
        assertThat(engine.valueAtRisk(series(100, 110, 130, 160), 0.95)).isCloseTo(-11.0, within(1e-9));
    }

    @Test
    void higherConfidenceNeverLowersVaR() throws Exception {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            values.add(1_000_000 + 20_000 * Math.sin(i * 0.9) + 500.0 * i);
        }
        PortfolioValueSeries series = series(values.stream().mapToDouble(Double::doubleValue).toArray());

        assertThat(engine.valueAtRisk(series, 0.99)).isGreaterThanOrEqualTo(engine.valueAtRisk(series, 0.95));
    }

    @Test
    void singleDateIsInsufficientData() {
        assertThatThrownBy(() -> engine.valueAtRisk(series(100.0), 0.99))
                .isInstanceOf(RiskCalculationException.class)
                .extracting(e -> ((RiskCalculationException) e).kind())
                .isEqualTo(RiskErrorKind.INSUFFICIENT_HISTORY);
    }

    @Test
    void emptySeriesIsInsufficientData() {
        assertThatThrownBy(() -> engine.valueAtRisk(new PortfolioValueSeries(List.of()), 0.99))
                .isInstanceOf(RiskCalculationException.class)
                .hasMessageContaining("got 0");
    }

    @Test
    void rejectsInvalidConfidence() {
        assertThatThrownBy(() -> engine.valueAtRisk(series(1, 2, 3), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static PortfolioValueSeries series(double... values) {
        List<PortfolioValueSeries.Point> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new PortfolioValueSeries.Point(START.plusDays(i), values[i]));
        }
        return new PortfolioValueSeries(points);
    }
}
