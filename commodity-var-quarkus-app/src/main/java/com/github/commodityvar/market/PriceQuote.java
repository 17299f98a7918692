package com.github.commodityvar.market;

import java.time.LocalDate;

/**
 * One market observation for an instrument.
 *
 * @param key        Instrument the quote belongs to
 * @param quoteDate  Date of the observation
 * @param quoteValue Raw quote as published
 * @param unit       Quote unit, e.g. {@code USD/LB}
 * @param massQuote  Quote converted to a price per metric ton
 */
public record PriceQuote(
        InstrumentKey key,
        LocalDate quoteDate,
        double quoteValue,
        String unit,
        double massQuote
) {
}
