package com.github.commodityvar.market;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-quality gate flagging quotes far from the rest of their instrument's series.
 * <p>
 * Each quote is scored against its own instrument group with the population
 * z-score and flagged when {@code |z| > threshold}. Groups with fewer than two
 * quotes or no dispersion never flag anything.
 */
public class OutlierDetector {

    private static final Logger LOG = Logger.getLogger(OutlierDetector.class);

    public static final double DEFAULT_THRESHOLD = 4.0;

    private final double threshold;

    public OutlierDetector(double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Outlier threshold must be positive and finite: " + threshold);
        }
        this.threshold = threshold;
    }

    public OutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public OutlierReport detect(List<PriceQuote> quotes) {
        Map<InstrumentKey, List<PriceQuote>> groups = new LinkedHashMap<>();
        for (PriceQuote quote : quotes) {
            groups.computeIfAbsent(quote.key(), k -> new ArrayList<>()).add(quote);
        }

        Map<PriceQuote, Double> scores = new IdentityHashMap<>();
        for (Map.Entry<InstrumentKey, List<PriceQuote>> group : groups.entrySet()) {
            scoreGroup(group.getKey(), group.getValue(), scores);
        }

        // Report in input order
        List<OutlierReport.FlaggedQuote> flagged = new ArrayList<>();
        for (PriceQuote quote : quotes) {
            Double z = scores.get(quote);
            if (z != null) {
                flagged.add(new OutlierReport.FlaggedQuote(quote, z));
            }
        }
        LOG.debugf("Flagged %d of %d quotes at |z| > %.2f",
                Integer.valueOf(flagged.size()), Integer.valueOf(quotes.size()), Double.valueOf(threshold));
        return new OutlierReport(flagged.size(), threshold, List.copyOf(flagged));
    }

    public double threshold() {
        return threshold;
    }

    private void scoreGroup(InstrumentKey key, List<PriceQuote> group, Map<PriceQuote, Double> scores) {
        if (group.size() < 2) {
            return;
        }
        double[] values = group.stream().mapToDouble(PriceQuote::quoteValue).toArray();
        double mean = new Mean().evaluate(values);
        double stdDev = new StandardDeviation(false).evaluate(values, mean);
        if (stdDev == 0.0 || Double.isNaN(stdDev)) {
            LOG.tracef("No dispersion in %s, nothing to flag", key);
            return;
        }
        for (PriceQuote quote : group) {
            double z = (quote.quoteValue() - mean) / stdDev;
            if (Math.abs(z) > threshold) {
                scores.put(quote, z);
            }
        }
    }
}
