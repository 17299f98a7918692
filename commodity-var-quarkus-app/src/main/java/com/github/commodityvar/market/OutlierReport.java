package com.github.commodityvar.market;

import java.util.List;

/**
 * Quotes flagged by {@link OutlierDetector}.
 *
 * @param outlierCount Number of flagged quotes
 * @param threshold    Absolute z-score above which a quote was flagged
 * @param outliers     The flagged quotes with their z-scores, in input order
 */
public record OutlierReport(
        int outlierCount,
        double threshold,
        List<FlaggedQuote> outliers
) {

    public record FlaggedQuote(PriceQuote quote, double zScore) {
    }
}
