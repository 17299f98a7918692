package com.github.commodityvar.market;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats contract maturities as the month label used in {@link InstrumentKey}.
 */
public final class MaturityLabels {

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM-yyyy", Locale.ENGLISH);

    private MaturityLabels() {
    }

    public static String of(LocalDate maturity) {
        return MONTH_LABEL.format(maturity);
    }

    public static String of(YearMonth maturity) {
        return MONTH_LABEL.format(maturity);
    }
}
