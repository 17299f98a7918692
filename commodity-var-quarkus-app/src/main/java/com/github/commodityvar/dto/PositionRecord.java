package com.github.commodityvar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Position as delivered by the snapshot loader. Either {@code maturityMonthLabel}
 * ({@code Oct-2024}) or {@code maturity} must be set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionRecord(
        String metal,
        String maturityMonthLabel,
        LocalDate maturity,
        String exchange,
        String contractType,
        String businessLine,
        String strategy,
        String currency,
        String longShort,
        Double volume,
        String unit
) {}
