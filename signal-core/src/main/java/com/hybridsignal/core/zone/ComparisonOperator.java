package com.hybridsignal.core.zone;

import com.hybridsignal.core.exception.ThresholdConfigurationException;

/**
 * Predicate applied by a {@link ZoneThreshold} to an indicator value.
 *
 * <p>Single-bound operators compare against {@code minValue}; {@link #BETWEEN} is inclusive
 * on both {@code minValue} and {@code maxValue}.
 */
public enum ComparisonOperator {

    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    BETWEEN("between");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double minValue, Double maxValue) {
        return switch (this) {
            case GT      -> value >  minValue;
            case GTE     -> value >= minValue;
            case LT      -> value <  minValue;
            case LTE     -> value <= minValue;
            case BETWEEN -> maxValue != null && value >= minValue && value <= maxValue;
        };
    }

    /** True when the operator bounds values from below (bullish-style thresholds). */
    public boolean hasLowerBound() {
        return this == GT || this == GTE || this == BETWEEN;
    }

    /** True when the operator bounds values from above (bearish-style thresholds). */
    public boolean hasUpperBound() {
        return this == LT || this == LTE || this == BETWEEN;
    }

    /**
     * Parses the configuration spelling ({@code ">"}, {@code ">="}, {@code "<"}, {@code "<="},
     * {@code "between"}) or the enum name.
     */
    public static ComparisonOperator fromSymbol(String raw) {
        if (raw == null) {
            throw new ThresholdConfigurationException("comparison operator is missing");
        }
        String s = raw.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(s) || op.name().equalsIgnoreCase(s)) {
                return op;
            }
        }
        throw new ThresholdConfigurationException("unknown comparison operator '" + raw + "'");
    }
}
