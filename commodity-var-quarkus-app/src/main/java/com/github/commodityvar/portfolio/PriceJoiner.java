package com.github.commodityvar.portfolio;

import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.market.PriceQuote;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Attaches market quotes to positions by {@link InstrumentKey}.
 * <p>
 * Built once over a price panel. When several quotes share an instrument and a
 * date, the one occurring last in the panel wins, for both join modes.
 */
public class PriceJoiner {

    // instrument -> date -> last quote of that day
    private final Map<InstrumentKey, NavigableMap<LocalDate, PriceQuote>> quotesByKey;

    private PriceJoiner(Map<InstrumentKey, NavigableMap<LocalDate, PriceQuote>> quotesByKey) {
        this.quotesByKey = quotesByKey;
    }

    public static PriceJoiner over(List<PriceQuote> quotes) {
        Map<InstrumentKey, NavigableMap<LocalDate, PriceQuote>> index = new HashMap<>();
        for (PriceQuote quote : quotes) {
            index.computeIfAbsent(quote.key(), k -> new TreeMap<>()).put(quote.quoteDate(), quote);
        }
        return new PriceJoiner(index);
    }

    /**
     * Joins each position to the most recent quote of its instrument.
     */
    public List<PricedPosition> joinLatest(List<Position> positions) {
        List<PricedPosition> priced = new ArrayList<>(positions.size());
        for (Position position : positions) {
            priced.add(attach(position, latestQuote(position.key())));
        }
        return priced;
    }

    /**
     * Joins each position to the most recent quote dated on or before {@code horizon}.
     */
    public List<PricedPosition> joinLatest(List<Position> positions, LocalDate horizon) {
        List<PricedPosition> priced = new ArrayList<>(positions.size());
        for (Position position : positions) {
            priced.add(attach(position, latestQuote(position.key(), horizon)));
        }
        return priced;
    }

    /**
     * Joins each position to the quote dated exactly {@code date}.
     */
    public List<PricedPosition> joinOn(List<Position> positions, LocalDate date) {
        List<PricedPosition> priced = new ArrayList<>(positions.size());
        for (Position position : positions) {
            priced.add(attach(position, quoteOn(position.key(), date)));
        }
        return priced;
    }

    public Optional<PriceQuote> latestQuote(InstrumentKey key) {
        NavigableMap<LocalDate, PriceQuote> series = quotesByKey.get(key);
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(series.lastEntry().getValue());
    }

    public Optional<PriceQuote> latestQuote(InstrumentKey key, LocalDate horizon) {
        NavigableMap<LocalDate, PriceQuote> series = quotesByKey.get(key);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, PriceQuote> entry = series.floorEntry(horizon);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    public Optional<PriceQuote> quoteOn(InstrumentKey key, LocalDate date) {
        NavigableMap<LocalDate, PriceQuote> series = quotesByKey.get(key);
        return series != null ? Optional.ofNullable(series.get(date)) : Optional.empty();
    }

    /**
     * Every quote date across all instruments, ascending.
     */
    public NavigableSet<LocalDate> distinctDates() {
        TreeSet<LocalDate> dates = new TreeSet<>();
        quotesByKey.values().forEach(series -> dates.addAll(series.keySet()));
        return dates;
    }

    public boolean hasQuotes(InstrumentKey key) {
        return quotesByKey.containsKey(key);
    }

    private static PricedPosition attach(Position position, Optional<PriceQuote> quote) {
        return quote.map(q -> PricedPosition.priced(position, q))
                .orElseGet(() -> PricedPosition.unpriced(position));
    }
}
