package com.github.commodityvar.risk;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Value-at-Risk from the empirical distribution of daily P&L.
 * <p>
 * P&L is the absolute change in portfolio value between consecutive dates of the
 * series. VaR is the negated {@code (1 - confidence)} quantile, interpolated
 * linearly between order statistics, so a loss shows as a positive number.
 */
public class HistoricalVaREngine {

    /**
     * @return the loss at the confidence level as a positive number. The result is
     * not clamped at zero: when even the lower quantile of daily P&L is a gain, as in
     * a series that only rises, the figure is negative.
     * @throws RiskCalculationException {@link RiskErrorKind#INSUFFICIENT_HISTORY} with fewer than two dates
     */
    public double valueAtRisk(PortfolioValueSeries series, double confidenceLevel) throws RiskCalculationException {
        ParametricVaREngine.checkConfidence(confidenceLevel);
        if (series.size() < 2) {
            throw new RiskCalculationException(RiskErrorKind.INSUFFICIENT_HISTORY,
                    "Need at least 2 fully priced dates for daily P&L but got " + series.size());
        }
        double quantile = lossQuantile(series.dailyChanges(), 1.0 - confidenceLevel);
        // 0.0 - q keeps a flat series at +0.0
        return 0.0 - quantile;
    }

    static double lossQuantile(double[] pnl, double probability) {
        return new Percentile()
                .withEstimationType(EstimationType.R_7)
                .evaluate(pnl, probability * 100.0);
    }
}
