package com.hybridsignal.core.zone;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over zone threshold configuration.
 *
 * <p>Implementations must return rows that have already passed {@link ZoneSetValidator};
 * empty lists signal "not configured" and trigger the matcher's fallback chain.
 */
public interface ThresholdSource {

    ZoneScale scale();

    List<ZoneThreshold> instrumentThresholds(String instrumentId, String timeframe, String indicatorName);

    List<ZoneThreshold> marketThresholds(String market, String timeframe, String indicatorName);

    /** Market classification (e.g. "US", "VN") used to pick the template set. */
    Optional<String> marketOf(String instrumentId);
}
