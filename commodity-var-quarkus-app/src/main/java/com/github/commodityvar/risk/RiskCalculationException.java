package com.github.commodityvar.risk;

/**
 * Raised when a VaR figure cannot be produced for a recoverable data reason.
 * Callers branch on {@link #kind()}.
 */
public class RiskCalculationException extends Exception {

    private final RiskErrorKind kind;

    public RiskCalculationException(RiskErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RiskErrorKind kind() {
        return kind;
    }
}
