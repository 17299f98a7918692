package com.github.commodityvar.risk;

/**
 * Expected data-quality conditions a VaR run can end in.
 */
public enum RiskErrorKind {

    /** No quote for an instrument under the requested join. */
    MISSING_MARKET_DATA("missing market data"),

    /** Gross position value is zero, weights are undefined. */
    ZERO_EXPOSURE("zero gross exposure"),

    /** Too few usable dates for returns or P&L. */
    INSUFFICIENT_HISTORY("insufficient data"),

    /** A price with no defined return, or a VaR figure that is not a finite number. */
    INVALID_MARKET_DATA("invalid market data"),

    /** Requested breakdown dimension is not a position attribute. */
    UNKNOWN_BREAKDOWN_COLUMN("unknown breakdown column");

    private final String description;

    RiskErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
