package com.github.commodityvar;

import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Builders for positions and quotes used across engine tests. Everything is in metric tons.
 */
public final class TestData {

    public static final InstrumentKey COPPER_OCT = new InstrumentKey("Copper", "Oct-2024", "LME");
    public static final InstrumentKey ZINC_OCT = new InstrumentKey("Zinc", "Oct-2024", "LME");
    public static final InstrumentKey LEAD_DEC = new InstrumentKey("Lead", "Dec-2024", "LME");

    public static final LocalDate START = LocalDate.of(2024, 9, 2);

    private TestData() {
    }

    public static Position longPosition(InstrumentKey key, double tons) {
        return position(key, "Copper", tons);
    }

    public static Position shortPosition(InstrumentKey key, double tons) {
        return position(key, "Copper", -tons);
    }

    /**
     * @param signedTons positive for long, negative for short
     */
    public static Position position(InstrumentKey key, String businessLine, double signedTons) {
        String side = signedTons >= 0 ? "L" : "S";
        return new Position(key, "Future", businessLine, "Outright", "USD", side,
                Math.abs(signedTons), "MT", Math.abs(signedTons), signedTons);
    }

    public static PriceQuote quote(InstrumentKey key, LocalDate date, double pricePerTon) {
        return new PriceQuote(key, date, pricePerTon, "USD/MT", pricePerTon);
    }

    /**
     * One quote per calendar day starting at {@link #START}.
     */
    public static List<PriceQuote> dailySeries(InstrumentKey key, int days, IntToDoubleFunction priceOnDay) {
        List<PriceQuote> quotes = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            quotes.add(quote(key, START.plusDays(i), priceOnDay.applyAsDouble(i)));
        }
        return quotes;
    }

    /**
     * 9000 to 9500 over 30 days with an alternating +/-40 wiggle, so there are down days.
     */
    public static List<PriceQuote> copperTrend() {
        return dailySeries(COPPER_OCT, 30, i -> 9000.0 + 500.0 * i / 29 + (i % 2 == 0 ? 40.0 : -40.0));
    }

    public static List<PriceQuote> concat(List<PriceQuote> first, List<PriceQuote> second) {
        List<PriceQuote> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
