package com.hybridsignal.core.zone;

/**
 * Region of the real line covered by one {@link ZoneThreshold}. Used only for load-time
 * validation of zone sets.
 */
record ZoneInterval(double low, boolean lowInclusive, double high, boolean highInclusive) {

    static ZoneInterval of(ComparisonOperator op, double min, Double max) {
        return switch (op) {
            case GT      -> new ZoneInterval(min, false, Double.POSITIVE_INFINITY, false);
            case GTE     -> new ZoneInterval(min, true, Double.POSITIVE_INFINITY, false);
            case LT      -> new ZoneInterval(Double.NEGATIVE_INFINITY, false, min, false);
            case LTE     -> new ZoneInterval(Double.NEGATIVE_INFINITY, false, min, true);
            case BETWEEN -> new ZoneInterval(min, true, max, true);
        };
    }

    /** True when every point of {@code other} is also in this interval. */
    boolean encloses(ZoneInterval other) {
        boolean lowOk = other.low > low
            || (other.low == low && (lowInclusive || !other.lowInclusive));
        boolean highOk = other.high < high
            || (other.high == high && (highInclusive || !other.highInclusive));
        return lowOk && highOk;
    }

    boolean intersects(ZoneInterval other) {
        double maxLow  = Math.max(low, other.low);
        double minHigh = Math.min(high, other.high);
        if (maxLow < minHigh) {
            return true;
        }
        if (maxLow > minHigh) {
            return false;
        }
        return contains(maxLow) && other.contains(maxLow);
    }

    private boolean contains(double v) {
        boolean aboveLow  = v > low  || (v == low  && lowInclusive);
        boolean belowHigh = v < high || (v == high && highInclusive);
        return aboveLow && belowHigh;
    }
}
