package com.hybridsignal.core.zone;

import com.hybridsignal.core.exception.ThresholdConfigurationException;
import com.hybridsignal.core.model.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered list of zone names, most bullish first, with {@value #NEUTRAL} as the anchor.
 *
 * <p>The scale answers three questions about a zone name:
 * <ul>
 *   <li>{@link #polarity(String)} : which side of neutral it lies on</li>
 *   <li>{@link #intensity(String)}: distance from neutral divided by the longest side, in [0, 1]</li>
 *   <li>{@link #evaluationOrder()}: the order the matcher tries zones in: most extreme first,
 *       both sides interleaved, bullish before bearish at equal distance, neutral last</li>
 * </ul>
 *
 * <p>Immutable and thread-safe. Unknown zone names are treated as neutral.
 */
public final class ZoneScale {

    public static final String NEUTRAL = "neutral";

    /** igr / greed / bull / pos / neutral / neg / bear / fear / panic. */
    public static final ZoneScale DEFAULT = of(List.of(
        "igr", "greed", "bull", "pos", NEUTRAL, "neg", "bear", "fear", "panic"));

    /** Simple bull / neutral / bear triad. */
    public static final ZoneScale TRIAD = of(List.of("bull", NEUTRAL, "bear"));

    private final List<String> zones;
    private final int neutralIndex;
    private final int maxDistance;
    private final Map<String, Integer> indexByZone;
    private final List<String> evaluationOrder;

    private ZoneScale(List<String> zones) {
        this.zones = List.copyOf(zones);
        this.indexByZone = new HashMap<>();
        for (int i = 0; i < this.zones.size(); i++) {
            indexByZone.put(this.zones.get(i), i);
        }
        this.neutralIndex = indexByZone.get(NEUTRAL);
        this.maxDistance  = Math.max(1, Math.max(neutralIndex, this.zones.size() - 1 - neutralIndex));

        List<String> order = new ArrayList<>(this.zones);
        order.sort(Comparator
            .comparingInt((String z) -> -distance(z))
            .thenComparingInt(z -> indexByZone.get(z)));
        this.evaluationOrder = List.copyOf(order);
    }

    /**
     * Builds a scale from zone names ordered most bullish → most bearish.
     *
     * @throws ThresholdConfigurationException when {@value #NEUTRAL} is missing or a name repeats
     */
    public static ZoneScale of(List<String> orderedZones) {
        if (orderedZones == null || orderedZones.isEmpty()) {
            throw new ThresholdConfigurationException("zone order is empty");
        }
        List<String> normalized = new ArrayList<>();
        for (String z : orderedZones) {
            String name = normalize(z);
            if (name.isEmpty()) {
                throw new ThresholdConfigurationException("zone order contains a blank name");
            }
            if (normalized.contains(name)) {
                throw new ThresholdConfigurationException("zone '" + name + "' appears twice in zone order");
            }
            normalized.add(name);
        }
        if (!normalized.contains(NEUTRAL)) {
            throw new ThresholdConfigurationException("zone order must contain '" + NEUTRAL + "'");
        }
        return new ZoneScale(normalized);
    }

    public List<String> zones() {
        return zones;
    }

    public List<String> evaluationOrder() {
        return evaluationOrder;
    }

    public boolean contains(String zone) {
        return zone != null && indexByZone.containsKey(normalize(zone));
    }

    /** BUY for zones above neutral, SELL below, NEUTRAL for neutral and unknown names. */
    public Direction polarity(String zone) {
        Integer idx = zone == null ? null : indexByZone.get(normalize(zone));
        if (idx == null || idx == neutralIndex) {
            return Direction.NEUTRAL;
        }
        return idx < neutralIndex ? Direction.BUY : Direction.SELL;
    }

    public double intensity(String zone) {
        return (double) distance(zone) / maxDistance;
    }

    /** Position in {@link #evaluationOrder()}; unknown names sort last. */
    public int priority(String zone) {
        int idx = zone == null ? -1 : evaluationOrder.indexOf(normalize(zone));
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    int distance(String zone) {
        Integer idx = zone == null ? null : indexByZone.get(normalize(zone));
        return idx == null ? 0 : Math.abs(idx - neutralIndex);
    }

    private static String normalize(String zone) {
        return zone == null ? "" : zone.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "ZoneScale" + zones;
    }
}
