package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.BreakdownDimension;
import com.github.commodityvar.portfolio.Position;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a {@link VaRModel} for the whole book and for every value of each
 * requested breakdown dimension.
 * <p>
 * Only positions are partitioned. Each partition is valued against the full price
 * history restricted to the instruments it holds. A failing partition is recorded
 * as a {@link PartitionResult} and never stops the others; a dimension that is not
 * a position attribute is reported and skipped.
 */
public class PortfolioAggregator {

    private static final Logger LOG = Logger.getLogger(PortfolioAggregator.class);

    private final VaRModel model;
    private final boolean parallel;

    public PortfolioAggregator(VaRModel model, boolean parallel) {
        this.model = model;
        this.parallel = parallel;
    }

    public PortfolioAggregator(VaRModel model) {
        this(model, false);
    }

    /**
     * @return results per requested dimension label, in request order
     */
    public Map<String, List<PartitionResult>> breakdown(
            List<String> dimensions,
            List<Position> positions,
            List<PriceQuote> quotes
    ) {
        Map<String, List<PartitionResult>> results = new LinkedHashMap<>();
        for (String label : dimensions) {
            if (results.containsKey(label)) {
                continue;
            }
            Optional<BreakdownDimension> dimension = BreakdownDimension.fromLabel(label);
            if (dimension.isEmpty()) {
                LOG.warnf("Breakdown column '%s' is not a position attribute, skipping it", label);
                results.put(label, List.of(PartitionResult.failure(label, null,
                        RiskErrorKind.UNKNOWN_BREAKDOWN_COLUMN, "Unknown breakdown column: " + label)));
                continue;
            }
            results.put(label, breakdown(dimension.get(), positions, quotes));
        }
        return results;
    }

    public PartitionResult total(List<Position> positions, List<PriceQuote> quotes) {
        return evaluate(BreakdownDimension.TOTAL.label(), BreakdownDimension.TOTAL_PARTITION, positions, quotes);
    }

    List<PartitionResult> breakdown(BreakdownDimension dimension, List<Position> positions, List<PriceQuote> quotes) {
        Map<String, List<Position>> partitions = positions.stream()
                .collect(Collectors.groupingBy(dimension::partitionOf, TreeMap::new, Collectors.toList()));
        if (dimension == BreakdownDimension.TOTAL && partitions.isEmpty()) {
            partitions.put(BreakdownDimension.TOTAL_PARTITION, List.of());
        }

        Stream<Map.Entry<String, List<Position>>> stream = parallel
                ? partitions.entrySet().parallelStream()
                : partitions.entrySet().stream();
        return stream
                .map(e -> evaluate(dimension.label(), e.getKey(), e.getValue(), quotes))
                .toList();
    }

    private PartitionResult evaluate(String dimension, String value, List<Position> positions, List<PriceQuote> quotes) {
        try {
            double var = model.valueAtRisk(positions, restrictTo(positions, quotes));
            LOG.debugf("%s VaR for %s=%s: %.2f", model.name(), dimension, value, var);
            return PartitionResult.success(dimension, value, var);
        } catch (RiskCalculationException e) {
            LOG.warnf("%s VaR for %s=%s failed (%s): %s", model.name(), dimension, value, e.kind(), e.getMessage());
            return PartitionResult.failure(dimension, value, e);
        }
    }

    static List<PriceQuote> restrictTo(List<Position> positions, List<PriceQuote> quotes) {
        Set<InstrumentKey> held = positions.stream().map(Position::key).collect(Collectors.toSet());
        return quotes.stream().filter(q -> held.contains(q.key())).toList();
    }
}
