package com.hybridsignal.core.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hybridsignal.core.exception.ThresholdConfigurationException;

import java.util.Locale;
import java.util.Objects;

/**
 * One configured zone boundary for an (owner, timeframe, indicator) key.
 *
 * <p>{@code instrumentId} holds the instrument for per-instrument rows and the market code for
 * market-level template rows. Zone names are normalized to lower case.
 */
public record ZoneThreshold(
    @JsonProperty("instrumentId") String instrumentId,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("indicatorName") String indicatorName,
    @JsonProperty("zoneName") String zoneName,
    @JsonProperty("comparison") ComparisonOperator comparison,
    @JsonProperty("minValue") double minValue,
    @JsonProperty("maxValue") Double maxValue
) {

    public ZoneThreshold {
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(indicatorName, "indicatorName");
        Objects.requireNonNull(zoneName, "zoneName");
        Objects.requireNonNull(comparison, "comparison");
        zoneName = zoneName.trim().toLowerCase(Locale.ROOT);
        if (Double.isNaN(minValue)) {
            throw new ThresholdConfigurationException(
                "zone '" + zoneName + "' of " + indicatorName + "@" + timeframe + " has no min value");
        }
        if (comparison == ComparisonOperator.BETWEEN) {
            if (maxValue == null || maxValue.isNaN()) {
                throw new ThresholdConfigurationException(
                    "zone '" + zoneName + "' of " + indicatorName + "@" + timeframe
                    + " uses 'between' without a max value");
            }
            if (maxValue < minValue) {
                throw new ThresholdConfigurationException(
                    "zone '" + zoneName + "' of " + indicatorName + "@" + timeframe
                    + " has max " + maxValue + " below min " + minValue);
            }
        }
    }

    public static ZoneThreshold of(String instrumentId, String timeframe, String indicatorName,
                                   String zoneName, ComparisonOperator comparison,
                                   double minValue, Double maxValue) {
        return new ZoneThreshold(instrumentId, timeframe, indicatorName, zoneName,
                                 comparison, minValue, maxValue);
    }

    public boolean matches(double value) {
        return comparison.test(value, minValue, maxValue);
    }

    ZoneInterval interval() {
        return ZoneInterval.of(comparison, minValue, maxValue);
    }

    /** Edge nearest neutral for bullish-side zones. */
    double lowerBound() {
        return minValue;
    }

    /** Edge nearest neutral for bearish-side zones. */
    double upperBound() {
        return comparison == ComparisonOperator.BETWEEN ? maxValue : minValue;
    }
}
