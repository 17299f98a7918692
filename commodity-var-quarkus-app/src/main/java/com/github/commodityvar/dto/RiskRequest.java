package com.github.commodityvar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Snapshot to run VaR on. Null settings fall back to the configured defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskRequest(
        List<PositionRecord> positions,
        List<PriceRecord> prices,
        String method,
        Double confidenceLevel,
        Integer lookbackDays,
        Integer horizonDays,
        List<String> breakdownDimensions
) {
    public static RiskRequest of(List<PositionRecord> positions, List<PriceRecord> prices) {
        return new RiskRequest(positions, prices, null, null, null, null, null);
    }
}
