package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.portfolio.PricedPosition;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes portfolio value and signed weights from priced positions.
 * <p>
 * Weights are normalized by gross exposure, not net value. Positions without a
 * price are left out and logged.
 */
public class WeightCalculator {

    private static final Logger LOG = Logger.getLogger(WeightCalculator.class);

    /**
     * Sum of absolute signed position values over priced positions.
     */
    public double grossExposure(List<PricedPosition> positions) {
        return positions.stream()
                .filter(PricedPosition::isPriced)
                .mapToDouble(p -> Math.abs(p.signedValue()))
                .sum();
    }

    /**
     * Book value VaR is scaled by, the gross exposure.
     */
    public double portfolioValue(List<PricedPosition> positions) {
        return grossExposure(positions);
    }

    public WeightVector weights(List<PricedPosition> positions) throws RiskCalculationException {
        long unpriced = positions.stream().filter(p -> !p.isPriced()).count();
        if (unpriced > 0) {
            LOG.warnf("%d of %d positions have no price and are left out of the weights", unpriced, positions.size());
        }

        double gross = grossExposure(positions);
        if (gross == 0.0) {
            throw new RiskCalculationException(RiskErrorKind.ZERO_EXPOSURE,
                    "Gross exposure of " + (positions.size() - unpriced) + " priced positions is zero, weights are undefined");
        }

        Map<InstrumentKey, Double> signedValues = new TreeMap<>();
        for (PricedPosition position : positions) {
            if (position.isPriced()) {
                signedValues.merge(position.position().key(), position.signedValue(), Double::sum);
            }
        }
        signedValues.replaceAll((key, value) -> value / gross);
        return new WeightVector(signedValues, gross);
    }
}
