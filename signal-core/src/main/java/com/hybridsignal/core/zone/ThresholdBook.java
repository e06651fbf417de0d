package com.hybridsignal.core.zone;

import com.hybridsignal.core.exception.ThresholdConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated in-memory {@link ThresholdSource}.
 *
 * <p>Built once per configuration load through {@link Builder}; {@link Builder#build()} runs
 * {@link ZoneSetValidator} over every key and fails fast with
 * {@link ThresholdConfigurationException}. Rows are stored pre-sorted in evaluation order.
 *
 * <p>Market resolution for an instrument: explicit instrument → market mapping first, then the
 * configured default market, otherwise none.
 */
public final class ThresholdBook implements ThresholdSource {

    private static final Logger log = LoggerFactory.getLogger(ThresholdBook.class);

    private final ZoneScale scale;
    private final Map<Key, List<ZoneThreshold>> instrumentRows;
    private final Map<Key, List<ZoneThreshold>> marketRows;
    private final Map<String, String> instrumentMarkets;
    private final String defaultMarket;

    private ThresholdBook(ZoneScale scale,
                          Map<Key, List<ZoneThreshold>> instrumentRows,
                          Map<Key, List<ZoneThreshold>> marketRows,
                          Map<String, String> instrumentMarkets,
                          String defaultMarket) {
        this.scale             = scale;
        this.instrumentRows    = Map.copyOf(instrumentRows);
        this.marketRows        = Map.copyOf(marketRows);
        this.instrumentMarkets = Map.copyOf(instrumentMarkets);
        this.defaultMarket     = defaultMarket;
    }

    public static Builder builder(ZoneScale scale) {
        return new Builder(scale);
    }

    /** Book with no rows at all; every lookup falls through to the neutral sentinel. */
    public static ThresholdBook empty(ZoneScale scale) {
        return builder(scale).build();
    }

    @Override
    public ZoneScale scale() {
        return scale;
    }

    @Override
    public List<ZoneThreshold> instrumentThresholds(String instrumentId, String timeframe, String indicatorName) {
        return instrumentRows.getOrDefault(new Key(instrumentId, timeframe, indicatorName), List.of());
    }

    @Override
    public List<ZoneThreshold> marketThresholds(String market, String timeframe, String indicatorName) {
        return marketRows.getOrDefault(new Key(market, timeframe, indicatorName), List.of());
    }

    @Override
    public Optional<String> marketOf(String instrumentId) {
        String market = instrumentId == null ? null : instrumentMarkets.get(instrumentId);
        return Optional.ofNullable(market != null ? market : defaultMarket);
    }

    public int instrumentKeyCount() {
        return instrumentRows.size();
    }

    public int marketKeyCount() {
        return marketRows.size();
    }

    private record Key(String owner, String timeframe, String indicator) {}

    public static final class Builder {

        private final ZoneScale scale;
        private final Map<Key, List<ZoneThreshold>> instrumentRows = new LinkedHashMap<>();
        private final Map<Key, List<ZoneThreshold>> marketRows     = new LinkedHashMap<>();
        private final Map<String, String> instrumentMarkets        = new HashMap<>();
        private String defaultMarket;

        private Builder(ZoneScale scale) {
            this.scale = Objects.requireNonNull(scale, "scale");
        }

        /** Adds a per-instrument row; {@link ZoneThreshold#instrumentId()} is the owner. */
        public Builder instrumentThreshold(ZoneThreshold row) {
            if (row.instrumentId() == null || row.instrumentId().isBlank()) {
                throw new ThresholdConfigurationException(
                    "instrument threshold for zone '" + row.zoneName() + "' has no instrument id");
            }
            instrumentRows.computeIfAbsent(keyOf(row.instrumentId(), row), k -> new ArrayList<>()).add(row);
            return this;
        }

        /** Adds a market template row owned by {@code market}. */
        public Builder marketThreshold(String market, ZoneThreshold row) {
            if (market == null || market.isBlank()) {
                throw new ThresholdConfigurationException(
                    "market threshold for zone '" + row.zoneName() + "' has no market");
            }
            marketRows.computeIfAbsent(keyOf(market, row), k -> new ArrayList<>()).add(row);
            return this;
        }

        public Builder instrumentMarket(String instrumentId, String market) {
            instrumentMarkets.put(instrumentId, market);
            return this;
        }

        public Builder defaultMarket(String market) {
            this.defaultMarket = (market == null || market.isBlank()) ? null : market;
            return this;
        }

        /**
         * Validates and freezes the configuration.
         *
         * @throws ThresholdConfigurationException on the first ambiguous or malformed key
         */
        public ThresholdBook build() {
            Map<Key, List<ZoneThreshold>> validatedInstruments = validateAll(instrumentRows, "instrument");
            Map<Key, List<ZoneThreshold>> validatedMarkets     = validateAll(marketRows, "market");
            log.info("THRESHOLDS_LOADED instrumentKeys={} marketKeys={} mappedInstruments={} defaultMarket={}",
                     validatedInstruments.size(), validatedMarkets.size(),
                     instrumentMarkets.size(), defaultMarket);
            return new ThresholdBook(scale, validatedInstruments, validatedMarkets,
                                     instrumentMarkets, defaultMarket);
        }

        private Map<Key, List<ZoneThreshold>> validateAll(Map<Key, List<ZoneThreshold>> rows, String kind) {
            Map<Key, List<ZoneThreshold>> out = new HashMap<>();
            rows.forEach((key, list) -> {
                String label = kind + " " + key.owner() + " " + key.indicator() + "@" + key.timeframe();
                out.put(key, ZoneSetValidator.validate(scale, list, label));
            });
            return out;
        }

        private static Key keyOf(String owner, ZoneThreshold row) {
            return new Key(owner, row.timeframe(), row.indicatorName());
        }
    }
}
