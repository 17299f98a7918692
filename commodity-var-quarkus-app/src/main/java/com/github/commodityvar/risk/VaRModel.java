package com.github.commodityvar.risk;

import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;

import java.util.List;
import java.util.Locale;

/**
 * A complete VaR pipeline for one set of positions.
 * Implementations: {@link ParametricVaRModel}, {@link HistoricalVaRModel}
 */
public interface VaRModel {

    String PARAMETRIC = "parametric";
    String HISTORICAL = "historical";

    String name();

    /**
     * @param positions Positions of the book or partition
     * @param quotes    Price history, already restricted to the positions' instruments
     */
    double valueAtRisk(List<Position> positions, List<PriceQuote> quotes) throws RiskCalculationException;

    static boolean isKnown(String method) {
        if (method == null) {
            return false;
        }
        String normalized = method.trim().toLowerCase(Locale.ROOT);
        return PARAMETRIC.equals(normalized) || HISTORICAL.equals(normalized);
    }
}
