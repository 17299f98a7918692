package com.github.commodityvar;

import com.github.commodityvar.risk.PartitionResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a VaR run over a book snapshot.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li><b>totalVaR</b>: VaR of the whole book, null when it could not be computed.
 *       {@code totalVaRStatus} then holds the failure kind and {@code totalVaRMessage}
 *       the cause, e.g. "insufficient data: Only 1 complete price dates ...".</li>
 *   <li><b>varByLevel</b>: breakdown dimension to partition value to VaR. Failed
 *       partitions are absent here and listed in {@code failures}.</li>
 *   <li><b>outlierCount</b>: quotes flagged by the z-score data-quality check.</li>
 *   <li><b>unpricedPositions</b>: positions whose instrument has no quote at all.</li>
 *   <li><b>unrecognizedUnits</b>, <b>ambiguousSideTags</b>: inputs that passed through
 *       the permissive unit and long/short rules.</li>
 * </ul>
 * Values are monetary amounts in the quote currency, unrounded.
 */
public record VaRReport(
        String method,
        double confidenceLevel,
        int lookbackDays,
        int horizonDays,
        Double totalVaR,
        String totalVaRStatus,
        String totalVaRMessage,
        Map<String, Map<String, Double>> varByLevel,
        List<PartitionResult> failures,
        int outlierCount,
        int unpricedPositions,
        Set<String> unrecognizedUnits,
        Set<String> ambiguousSideTags
) {
    public static final String STATUS_OK = "OK";

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String method;
        private double confidenceLevel;
        private int lookbackDays;
        private int horizonDays;
        private PartitionResult total;
        private Map<String, List<PartitionResult>> breakdown = Map.of();
        private int outlierCount;
        private int unpricedPositions;
        private Set<String> unrecognizedUnits = Set.of();
        private Set<String> ambiguousSideTags = Set.of();

        public Builder settings(RunSettings settings) {
            this.method = settings.method();
            this.confidenceLevel = settings.confidenceLevel();
            this.lookbackDays = settings.lookbackDays();
            this.horizonDays = settings.horizonDays();
            return this;
        }

        public Builder total(PartitionResult value) {
            this.total = value;
            return this;
        }

        public Builder breakdown(Map<String, List<PartitionResult>> value) {
            this.breakdown = value;
            return this;
        }

        public Builder outlierCount(int value) {
            this.outlierCount = value;
            return this;
        }

        public Builder unpricedPositions(int value) {
            this.unpricedPositions = value;
            return this;
        }

        public Builder unrecognizedUnits(Set<String> value) {
            this.unrecognizedUnits = value;
            return this;
        }

        public Builder ambiguousSideTags(Set<String> value) {
            this.ambiguousSideTags = value;
            return this;
        }

        public VaRReport build() {
            Objects.requireNonNull(method, "method is required");
            Objects.requireNonNull(total, "total is required");

            Map<String, Map<String, Double>> varByLevel = new LinkedHashMap<>();
            List<PartitionResult> failures = new ArrayList<>();
            breakdown.forEach((dimension, results) -> {
                Map<String, Double> level = new LinkedHashMap<>();
                for (PartitionResult result : results) {
                    if (result.isSuccess()) {
                        level.put(result.value(), result.var());
                    } else {
                        failures.add(result);
                    }
                }
                varByLevel.put(dimension, level);
            });

            return new VaRReport(
                    method,
                    confidenceLevel,
                    lookbackDays,
                    horizonDays,
                    total.var(),
                    total.isSuccess() ? STATUS_OK : total.error().name(),
                    total.isSuccess() ? null : total.error().description() + ": " + total.message(),
                    varByLevel,
                    List.copyOf(failures),
                    outlierCount,
                    unpricedPositions,
                    Set.copyOf(unrecognizedUnits),
                    Set.copyOf(ambiguousSideTags)
            );
        }
    }
}
