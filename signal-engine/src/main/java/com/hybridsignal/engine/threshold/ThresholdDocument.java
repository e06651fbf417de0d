package com.hybridsignal.engine.threshold;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * YAML shape of {@code thresholds.yml}.
 *
 * <pre>
 * zoneOrder: [igr, greed, bull, pos, neutral, neg, bear, fear, panic]
 * defaultMarket: GLOBAL
 * instrumentMarkets:
 *   AAPL: US
 * markets:
 *   US:
 *     - indicator: line
 *       timeframes: [1h, 4h]
 *       zones:
 *         - { zone: igr, comparison: "&gt;", min: 2.0 }
 * instruments:
 *   AAPL:
 *     - indicator: histogram
 *       timeframes: [1h]
 *       zones: [...]
 * </pre>
 */
public record ThresholdDocument(
    @JsonProperty("zoneOrder") List<String> zoneOrder,
    @JsonProperty("defaultMarket") String defaultMarket,
    @JsonProperty("instrumentMarkets") Map<String, String> instrumentMarkets,
    @JsonProperty("markets") Map<String, List<ZoneSet>> markets,
    @JsonProperty("instruments") Map<String, List<ZoneSet>> instruments
) {

    /** Zone rows shared by one indicator over one or more timeframes. */
    public record ZoneSet(
        @JsonProperty("indicator") String indicator,
        @JsonProperty("timeframes") List<String> timeframes,
        @JsonProperty("zones") List<ZoneRow> zones
    ) {}

    public record ZoneRow(
        @JsonProperty("zone") String zone,
        @JsonProperty("comparison") String comparison,
        @JsonProperty("min") Double min,
        @JsonProperty("max") Double max
    ) {}
}
