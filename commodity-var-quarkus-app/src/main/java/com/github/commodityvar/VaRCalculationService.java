package com.github.commodityvar;

import com.github.commodityvar.dto.PriceRecord;
import com.github.commodityvar.dto.RiskRequest;
import com.github.commodityvar.market.OutlierDetector;
import com.github.commodityvar.market.OutlierReport;
import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.market.UnitNormalizer;
import com.github.commodityvar.portfolio.BreakdownDimension;
import com.github.commodityvar.portfolio.Position;
import com.github.commodityvar.portfolio.PriceJoiner;
import com.github.commodityvar.risk.HistoricalVaRModel;
import com.github.commodityvar.risk.ParametricVaRModel;
import com.github.commodityvar.risk.PartitionResult;
import com.github.commodityvar.risk.PortfolioAggregator;
import com.github.commodityvar.risk.VaRModel;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class VaRCalculationService {

    @Inject
    RiskEngineSettings settings;

    // ==================== VaR ====================

    public VaRReport calculate(RiskRequest request) {
        return calculate(request, null);
    }

    /**
     * Runs one VaR method over the snapshot for the whole book and every requested breakdown.
     *
     * @param method {@code parametric} or {@code historical}; null uses the request or configured method
     */
    public VaRReport calculate(RiskRequest request, String method) {
        RunSettings run = settings.resolve(request, method);
        UnitNormalizer normalizer = new UnitNormalizer(settings.positionUnits(), settings.priceUnits());
        RiskInputMapper mapper = new RiskInputMapper(normalizer);

        List<Position> positions = mapper.toPositions(request.positions());
        List<PriceQuote> quotes = mapper.toQuotes(request.prices());
        Log.infof("Running %s VaR on %d positions and %d quotes", run.method(), positions.size(), quotes.size());

        int unpriced = countUnpriced(positions, quotes);
        if (unpriced > 0) {
            Log.warnf("%d positions have no market quote and carry no risk in this run", unpriced);
        }

        PortfolioAggregator aggregator = new PortfolioAggregator(createModel(run), run.parallelPartitions());
        Map<String, List<PartitionResult>> breakdown = aggregator.breakdown(run.breakdownDimensions(), positions, quotes);
        PartitionResult total = totalOf(breakdown).orElseGet(() -> aggregator.total(positions, quotes));

        VaRReport report = VaRReport.builder()
                .settings(run)
                .total(total)
                .breakdown(breakdown)
                .outlierCount(new OutlierDetector(run.outlierThreshold()).detect(quotes).outlierCount())
                .unpricedPositions(unpriced)
                .unrecognizedUnits(normalizer.unrecognizedUnits())
                .ambiguousSideTags(normalizer.ambiguousSideTags())
                .build();

        if (total.isSuccess()) {
            Log.infof("Total %s VaR at %.2f%%: %.2f", run.method(), run.confidenceLevel() * 100, total.var());
        } else {
            Log.warnf("Total %s VaR unavailable: %s", run.method(), report.totalVaRMessage());
        }
        return report;
    }

    // ==================== Outliers ====================

    public OutlierReport detectOutliers(List<PriceRecord> prices, Double threshold) {
        double effectiveThreshold = threshold != null ? threshold : settings.defaults().outlierThreshold();
        UnitNormalizer normalizer = new UnitNormalizer(settings.positionUnits(), settings.priceUnits());
        List<PriceQuote> quotes = new RiskInputMapper(normalizer).toQuotes(prices);
        OutlierReport report = new OutlierDetector(effectiveThreshold).detect(quotes);
        Log.infof("Outlier check flagged %d of %d quotes", report.outlierCount(), quotes.size());
        return report;
    }

    static VaRModel createModel(RunSettings run) {
        if (VaRModel.HISTORICAL.equals(run.method())) {
            return new HistoricalVaRModel(run.confidenceLevel(), run.lookbackDays());
        }
        return new ParametricVaRModel(run.confidenceLevel(), run.lookbackDays(), run.horizonDays());
    }

    private static Optional<PartitionResult> totalOf(Map<String, List<PartitionResult>> breakdown) {
        return breakdown.values().stream()
                .flatMap(List::stream)
                .filter(r -> BreakdownDimension.TOTAL.label().equals(r.dimension())
                        && BreakdownDimension.TOTAL_PARTITION.equals(r.value()))
                .findFirst();
    }

    private static int countUnpriced(List<Position> positions, List<PriceQuote> quotes) {
        PriceJoiner joiner = PriceJoiner.over(quotes);
        return (int) positions.stream().filter(p -> !joiner.hasQuotes(p.key())).count();
    }
}
