package com.github.commodityvar.risk;

import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;
import com.github.commodityvar.portfolio.PriceJoiner;
import com.github.commodityvar.portfolio.PricedPosition;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Prices positions at their latest quote, estimates return covariance over the
 * lookback and scales the one-day parametric VaR to the configured horizon.
 */
public class ParametricVaRModel implements VaRModel {

    private static final Logger LOG = Logger.getLogger(ParametricVaRModel.class);

    private final double confidenceLevel;
    private final double zScore;
    private final int horizonDays;
    private final CovarianceEstimator covarianceEstimator;
    private final WeightCalculator weightCalculator;
    private final ParametricVaREngine engine;

    public ParametricVaRModel(double confidenceLevel, int lookbackDays, int horizonDays) {
        this(confidenceLevel, horizonDays, new CovarianceEstimator(lookbackDays), new WeightCalculator(), new ParametricVaREngine());
    }

    ParametricVaRModel(
            double confidenceLevel,
            int horizonDays,
            CovarianceEstimator covarianceEstimator,
            WeightCalculator weightCalculator,
            ParametricVaREngine engine
    ) {
        this.confidenceLevel = confidenceLevel;
        this.zScore = ParametricVaREngine.zScore(confidenceLevel);
        ParametricVaREngine.checkHorizon(horizonDays);
        this.horizonDays = horizonDays;
        this.covarianceEstimator = covarianceEstimator;
        this.weightCalculator = weightCalculator;
        this.engine = engine;
    }

    @Override
    public String name() {
        return PARAMETRIC;
    }

    @Override
    public double valueAtRisk(List<Position> positions, List<PriceQuote> quotes) throws RiskCalculationException {
        List<PricedPosition> priced = PriceJoiner.over(quotes).joinLatest(positions);
        if (priced.stream().noneMatch(PricedPosition::isPriced)) {
            throw new RiskCalculationException(RiskErrorKind.MISSING_MARKET_DATA,
                    "None of " + positions.size() + " positions has a market quote");
        }

        CovarianceMatrix covariance = covarianceEstimator.estimate(quotes);
        WeightVector weights = weightCalculator.weights(priced);
        double portfolioValue = weightCalculator.portfolioValue(priced);

        double oneDay = engine.valueAtRisk(weights, covariance, zScore, portfolioValue);
        double scaled = ParametricVaREngine.scaleToHorizon(oneDay, horizonDays);
        if (!Double.isFinite(scaled)) {
            throw new RiskCalculationException(RiskErrorKind.INVALID_MARKET_DATA, String.format(
                    "Parametric VaR is %s (value %s, %d instruments)", scaled, portfolioValue, covariance.size()));
        }
        LOG.debugf("Parametric VaR %.2f (1d %.2f, value %.2f, z %.4f, %d instruments)",
                scaled, oneDay, portfolioValue, zScore, covariance.size());
        return scaled;
    }

    public double confidenceLevel() {
        return confidenceLevel;
    }

    public double zScore() {
        return zScore;
    }

    public int horizonDays() {
        return horizonDays;
    }
}
