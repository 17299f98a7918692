package com.github.commodityvar.portfolio;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Position attributes a book can be sliced by.
 * <p>
 * Labels follow the column headers of the position snapshot ({@code BUSINESS LINE},
 * {@code METAL}, ...). {@link #TOTAL} puts the whole book in a single partition.
 */
public enum BreakdownDimension {

    TOTAL("Total", p -> "Total"),
    BUSINESS_LINE("BUSINESS LINE", Position::businessLine),
    METAL("METAL", p -> p.key().metal()),
    EXCHANGE("EXCHANGE", p -> p.key().exchange()),
    MATURITY("MATURITY", p -> p.key().maturityMonth()),
    STRATEGY("STRATEGY", Position::strategy),
    CONTRACT_TYPE("CONTRACTTYPE", Position::contractType),
    CURRENCY("CURRENCY", Position::currency);

    /** The single partition value of {@link #TOTAL}. */
    public static final String TOTAL_PARTITION = "Total";

    private final String label;
    private final Function<Position, String> accessor;

    BreakdownDimension(String label, Function<Position, String> accessor) {
        this.label = label;
        this.accessor = accessor;
    }

    public String label() {
        return label;
    }

    /**
     * Partition value of a position; missing attributes fall into an empty-string partition.
     */
    public String partitionOf(Position position) {
        String value = accessor.apply(position);
        return value != null ? value : "";
    }

    /**
     * Resolves a label case-insensitively; underscores and spaces are interchangeable.
     */
    public static Optional<BreakdownDimension> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = canonical(label);
        return Arrays.stream(values())
                .filter(d -> canonical(d.label).equals(wanted) || canonical(d.name()).equals(wanted))
                .findFirst();
    }

    private static String canonical(String label) {
        return label.trim().replace('_', ' ').toUpperCase(Locale.ROOT);
    }
}
