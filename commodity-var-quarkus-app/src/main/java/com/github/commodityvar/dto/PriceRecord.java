package com.github.commodityvar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceRecord(
        String metal,
        String maturityMonthLabel,
        LocalDate maturity,
        String exchange,
        LocalDate quoteDate,
        Double quoteValue,
        String unit
) {}
