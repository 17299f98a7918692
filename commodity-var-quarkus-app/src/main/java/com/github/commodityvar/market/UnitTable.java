package com.github.commodityvar.market;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Closed mapping of unit tags to their metric-ton conversion factor.
 * <p>
 * Position tables map a volume unit to tons per unit ({@code LB -> 0.0004536}).
 * Price tables map a quote unit to the same factor ({@code USD/LB -> 0.0004536});
 * a quote is divided by it to get a price per ton.
 */
public final class UnitTable {

    public static final double POUNDS_TO_METRIC_TONS = 0.0004536;

    private final Map<String, Double> factors;

    public UnitTable(Map<String, Double> factors) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        factors.forEach((unit, factor) -> {
            if (factor == null || !(factor > 0) || Double.isInfinite(factor)) {
                throw new IllegalArgumentException("Unit factor must be positive and finite: " + unit + "=" + factor);
            }
            normalized.put(normalize(unit), factor);
        });
        this.factors = Collections.unmodifiableMap(normalized);
    }

    public static UnitTable defaultPositionUnits() {
        return new UnitTable(Map.of("LB", POUNDS_TO_METRIC_TONS, "MT", 1.0));
    }

    public static UnitTable defaultPriceUnits() {
        return new UnitTable(Map.of("USD/LB", POUNDS_TO_METRIC_TONS, "USD/MT", 1.0));
    }

    /**
     * Parses a table written as {@code UNIT:factor} entries, e.g. {@code LB:0.0004536,MT:1.0}.
     */
    public static UnitTable parse(Iterable<String> entries) {
        Map<String, Double> factors = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            int separator = entry.lastIndexOf(':');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new IllegalArgumentException("Unit entry must look like UNIT:factor but was '" + entry + "'");
            }
            String unit = entry.substring(0, separator);
            try {
                factors.put(unit, Double.parseDouble(entry.substring(separator + 1).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid factor in unit entry '" + entry + "'", e);
            }
        }
        return new UnitTable(factors);
    }

    public OptionalDouble factor(String unit) {
        if (unit == null) {
            return OptionalDouble.empty();
        }
        Double factor = factors.get(normalize(unit));
        return factor != null ? OptionalDouble.of(factor) : OptionalDouble.empty();
    }

    public Map<String, Double> asMap() {
        return factors;
    }

    private static String normalize(String unit) {
        return unit.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return factors.toString();
    }
}
