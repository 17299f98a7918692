package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signed instrument weights normalized by gross exposure.
 *
 * @param weights       Weight per instrument, positive for net long and negative for net short
 * @param grossExposure Sum of absolute position values the weights were divided by
 */
public record WeightVector(
        Map<InstrumentKey, Double> weights,
        double grossExposure
) {

    public WeightVector {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public double weight(InstrumentKey key) {
        return weights.getOrDefault(key, 0.0);
    }

    /**
     * Sum of absolute weights, 1 when positions in the same instrument do not offset each other.
     */
    public double absoluteSum() {
        return weights.values().stream().mapToDouble(Math::abs).sum();
    }

    /**
     * Dense weights in the given order, 0 for instruments without a weight.
     */
    public double[] reindex(List<InstrumentKey> order) {
        double[] dense = new double[order.size()];
        for (int i = 0; i < order.size(); i++) {
            dense[i] = weight(order.get(i));
        }
        return dense;
    }
}
