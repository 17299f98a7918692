package com.github.commodityvar.risk;

import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;

import java.util.List;

/**
 * Revalues today's positions on every past date of the lookback and takes VaR
 * from the resulting daily P&L.
 */
public class HistoricalVaRModel implements VaRModel {

    private final double confidenceLevel;
    private final TimeSeriesReconstructor reconstructor;
    private final HistoricalVaREngine engine;

    public HistoricalVaRModel(double confidenceLevel, int lookbackDays) {
        this(confidenceLevel, new TimeSeriesReconstructor(lookbackDays), new HistoricalVaREngine());
    }

    HistoricalVaRModel(double confidenceLevel, TimeSeriesReconstructor reconstructor, HistoricalVaREngine engine) {
        ParametricVaREngine.checkConfidence(confidenceLevel);
        this.confidenceLevel = confidenceLevel;
        this.reconstructor = reconstructor;
        this.engine = engine;
    }

    @Override
    public String name() {
        return HISTORICAL;
    }

    @Override
    public double valueAtRisk(List<Position> positions, List<PriceQuote> quotes) throws RiskCalculationException {
        PortfolioValueSeries series = reconstructor.reconstruct(positions, quotes);
        double var = engine.valueAtRisk(series, confidenceLevel);
        if (!Double.isFinite(var)) {
            throw new RiskCalculationException(RiskErrorKind.INVALID_MARKET_DATA,
                    "Historical VaR is " + var + " over " + series.size() + " dates");
        }
        return var;
    }

    public double confidenceLevel() {
        return confidenceLevel;
    }
}
