package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.market.PriceQuote;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Estimates the covariance of simple daily returns across instruments.
 * <p>
 * Quotes are restricted to {@code [latest date - lookback, latest date]} and pivoted
 * into a date by instrument price panel. Gaps are forward-filled from the previous
 * date; dates still incomplete after the fill (before an instrument's first quote)
 * are dropped. Returns are {@code p(t) / p(t-1) - 1} and the covariance is the
 * sample covariance with an {@code n - 1} denominator. A price at or below zero
 * inside the window has no return and fails the estimate.
 */
public class CovarianceEstimator {

    private static final Logger LOG = Logger.getLogger(CovarianceEstimator.class);

    static final int MIN_RETURN_OBSERVATIONS = 2;

    private final int lookbackDays;

    public CovarianceEstimator(int lookbackDays) {
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("Lookback must not be negative: " + lookbackDays);
        }
        this.lookbackDays = lookbackDays;
    }

    public CovarianceMatrix estimate(List<PriceQuote> quotes) throws RiskCalculationException {
        List<PriceQuote> usable = quotes.stream()
                .filter(q -> Double.isFinite(q.massQuote()))
                .toList();
        if (usable.isEmpty()) {
            throw new RiskCalculationException(RiskErrorKind.INSUFFICIENT_HISTORY, "No price history to estimate covariance from");
        }

        LocalDate latest = usable.stream().map(PriceQuote::quoteDate).max(LocalDate::compareTo).orElseThrow();
        LocalDate start = latest.minusDays(lookbackDays);

        // date -> instrument -> price, last row of a day wins
        TreeMap<LocalDate, Map<InstrumentKey, Double>> panel = new TreeMap<>();
        TreeSet<InstrumentKey> instruments = new TreeSet<>();
        for (PriceQuote quote : usable) {
            if (quote.quoteDate().isBefore(start)) {
                continue;
            }
            if (quote.massQuote() <= 0.0) {
                throw new RiskCalculationException(RiskErrorKind.INVALID_MARKET_DATA, String.format(
                        "Price %s for %s on %s is not positive, returns are undefined",
                        quote.massQuote(), quote.key(), quote.quoteDate()));
            }
            panel.computeIfAbsent(quote.quoteDate(), d -> new TreeMap<>()).put(quote.key(), quote.massQuote());
            instruments.add(quote.key());
        }

        List<InstrumentKey> columns = new ArrayList<>(instruments);
        List<double[]> prices = forwardFilledRows(panel, columns);
        List<double[]> returns = simpleReturns(prices);

        if (returns.size() < MIN_RETURN_OBSERVATIONS) {
            throw new RiskCalculationException(RiskErrorKind.INSUFFICIENT_HISTORY, String.format(
                    "Only %d complete price dates between %s and %s for %d instruments",
                    prices.size(), start, latest, columns.size()));
        }

        RealMatrix covariance = new Covariance(returns.toArray(new double[0][]), true).getCovarianceMatrix();
        for (int i = 0; i < columns.size(); i++) {
            if (!Double.isFinite(covariance.getEntry(i, i))) {
                throw new RiskCalculationException(RiskErrorKind.INVALID_MARKET_DATA,
                        "Return variance of " + columns.get(i) + " is not a finite number");
            }
        }
        LOG.debugf("Estimated %dx%d covariance from %d returns ending %s", columns.size(), columns.size(), returns.size(), latest);
        return new CovarianceMatrix(columns, covariance.getData(), returns.size());
    }

    public int lookbackDays() {
        return lookbackDays;
    }

    private static List<double[]> forwardFilledRows(TreeMap<LocalDate, Map<InstrumentKey, Double>> panel, List<InstrumentKey> columns) {
        double[] last = new double[columns.size()];
        Arrays.fill(last, Double.NaN);
        List<double[]> rows = new ArrayList<>();
        for (Map<InstrumentKey, Double> day : panel.values()) {
            boolean complete = true;
            for (int j = 0; j < columns.size(); j++) {
                Double price = day.get(columns.get(j));
                if (price != null) {
                    last[j] = price;
                }
                if (Double.isNaN(last[j])) {
                    complete = false;
                }
            }
            if (complete) {
                rows.add(last.clone());
            }
        }
        return rows;
    }

    private static List<double[]> simpleReturns(List<double[]> prices) {
        List<double[]> returns = new ArrayList<>();
        for (int t = 1; t < prices.size(); t++) {
            double[] previous = prices.get(t - 1);
            double[] current = prices.get(t);
            double[] row = new double[current.length];
            for (int j = 0; j < current.length; j++) {
                row[j] = current[j] / previous[j] - 1.0;
            }
            returns.add(row);
        }
        return returns;
    }
}
