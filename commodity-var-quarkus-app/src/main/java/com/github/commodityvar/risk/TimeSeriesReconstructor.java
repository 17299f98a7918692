package com.github.commodityvar.risk;

import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.portfolio.Position;
import com.github.commodityvar.portfolio.PriceJoiner;
import com.github.commodityvar.portfolio.PricedPosition;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;

/**
 * Replays historical quotes against today's positions.
 * <p>
 * Every quote date within the lookback window is valued with exact-date prices.
 * A date enters the series only if every position has a quote on it; partially
 * priced days are dropped, never interpolated or partially summed.
 */
public class TimeSeriesReconstructor {

    private static final Logger LOG = Logger.getLogger(TimeSeriesReconstructor.class);

    private final int lookbackDays;

    public TimeSeriesReconstructor(int lookbackDays) {
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("Lookback must not be negative: " + lookbackDays);
        }
        this.lookbackDays = lookbackDays;
    }

    public PortfolioValueSeries reconstruct(List<Position> positions, List<PriceQuote> quotes) {
        if (positions.isEmpty() || quotes.isEmpty()) {
            return new PortfolioValueSeries(List.of());
        }

        PriceJoiner joiner = PriceJoiner.over(quotes);
        NavigableSet<LocalDate> dates = joiner.distinctDates();
        LocalDate start = dates.last().minusDays(lookbackDays);

        List<PortfolioValueSeries.Point> points = new ArrayList<>();
        int skipped = 0;
        for (LocalDate date : dates.tailSet(start, true)) {
            List<PricedPosition> priced = joiner.joinOn(positions, date);
            if (!priced.stream().allMatch(PricedPosition::isPriced)) {
                skipped++;
                continue;
            }
            double value = priced.stream().mapToDouble(PricedPosition::signedValue).sum();
            points.add(new PortfolioValueSeries.Point(date, value));
        }

        if (skipped > 0) {
            LOG.debugf("Dropped %d of %d dates with incomplete prices", skipped, skipped + points.size());
        }
        return new PortfolioValueSeries(points);
    }

    public int lookbackDays() {
        return lookbackDays;
    }
}
