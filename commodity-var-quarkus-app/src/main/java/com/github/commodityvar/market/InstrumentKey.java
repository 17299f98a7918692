package com.github.commodityvar.market;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a tradable contract: metal, maturity month label and exchange.
 * <p>
 * Used as the matching key between positions and quotes and as the index of
 * covariance matrices and weight vectors. The maturity is always a fixed
 * {@code MMM-yyyy} label (see {@link MaturityLabels}) so that matching is exact.
 *
 * @param metal         Metal name, e.g. {@code Copper}
 * @param maturityMonth Maturity month label, e.g. {@code Oct-2024}
 * @param exchange      Exchange code, e.g. {@code LME}
 */
public record InstrumentKey(
        String metal,
        String maturityMonth,
        String exchange
) implements Comparable<InstrumentKey> {

    private static final Comparator<InstrumentKey> ORDER = Comparator
            .comparing(InstrumentKey::metal)
            .thenComparing(InstrumentKey::maturityMonth)
            .thenComparing(InstrumentKey::exchange);

    public InstrumentKey {
        Objects.requireNonNull(metal, "metal is required");
        Objects.requireNonNull(maturityMonth, "maturityMonth is required");
        Objects.requireNonNull(exchange, "exchange is required");
    }

    @Override
    public int compareTo(InstrumentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return metal + "_" + maturityMonth + "_" + exchange;
    }
}
