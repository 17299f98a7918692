package com.github.commodityvar.risk;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Daily mark-to-market value of a fixed position set, in ascending date order.
 */
public record PortfolioValueSeries(List<Point> points) {

    public PortfolioValueSeries {
        points = points.stream().sorted(Comparator.comparing(Point::date)).toList();
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<LocalDate> dates() {
        return points.stream().map(Point::date).toList();
    }

    public double[] values() {
        return points.stream().mapToDouble(Point::value).toArray();
    }

    /**
     * Day-over-day value changes {@code v(t) - v(t-1)}, one fewer than the number of points.
     */
    public double[] dailyChanges() {
        if (points.size() < 2) {
            return new double[0];
        }
        double[] changes = new double[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            changes[i - 1] = points.get(i).value() - points.get(i - 1).value();
        }
        return changes;
    }

    public record Point(LocalDate date, double value) {
    }
}
