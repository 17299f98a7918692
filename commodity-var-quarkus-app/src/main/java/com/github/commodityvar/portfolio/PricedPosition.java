package com.github.commodityvar.portfolio;

import com.github.commodityvar.market.PriceQuote;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A position joined to the market quote selected for it, if any.
 */
public record PricedPosition(
        Position position,
        Optional<PriceQuote> quote
) {

    public static PricedPosition priced(Position position, PriceQuote quote) {
        return new PricedPosition(position, Optional.of(quote));
    }

    public static PricedPosition unpriced(Position position) {
        return new PricedPosition(position, Optional.empty());
    }

    public boolean isPriced() {
        return quote.isPresent();
    }

    /**
     * Price per metric ton, empty when no quote matched.
     */
    public OptionalDouble massPrice() {
        return quote.map(q -> OptionalDouble.of(q.massQuote())).orElse(OptionalDouble.empty());
    }

    public Optional<LocalDate> priceDate() {
        return quote.map(PriceQuote::quoteDate);
    }

    /**
     * Signed mark-to-market value; only defined for priced positions.
     */
    public double signedValue() {
        return position.signedVolume() * quote
                .orElseThrow(() -> new IllegalStateException("No price for " + position.key()))
                .massQuote();
    }
}
