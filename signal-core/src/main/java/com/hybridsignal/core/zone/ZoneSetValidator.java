package com.hybridsignal.core.zone;

import com.hybridsignal.core.exception.ThresholdConfigurationException;
import com.hybridsignal.core.model.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Load-time consistency check for the rows of a single (owner, timeframe, indicator) key.
 *
 * <p>Rules, checked in order:
 * <ol>
 *   <li>every zone name belongs to the {@link ZoneScale}</li>
 *   <li>a zone name appears at most once</li>
 *   <li>bullish-side lower bounds strictly decrease from the most extreme zone inwards;
 *       bearish-side upper bounds strictly increase from the most extreme zone inwards</li>
 *   <li>no zone is fully covered by a zone tried before it (it could never match)</li>
 *   <li>no two {@code between} ranges intersect</li>
 * </ol>
 *
 * <p>Any violation throws {@link ThresholdConfigurationException}; evaluation never sees an
 * ambiguous set.
 */
public final class ZoneSetValidator {

    private ZoneSetValidator() {}

    /**
     * @param scale zone scale the rows are evaluated against
     * @param rows  rows sharing one key, in any order
     * @param label human-readable key used in error messages
     * @return the rows sorted in evaluation order
     */
    public static List<ZoneThreshold> validate(ZoneScale scale, List<ZoneThreshold> rows, String label) {
        Set<String> seen = new HashSet<>();
        for (ZoneThreshold row : rows) {
            if (!scale.contains(row.zoneName())) {
                throw new ThresholdConfigurationException(
                    label + ": zone '" + row.zoneName() + "' is not part of " + scale);
            }
            if (!seen.add(row.zoneName())) {
                throw new ThresholdConfigurationException(
                    label + ": zone '" + row.zoneName() + "' is defined more than once");
            }
        }

        List<ZoneThreshold> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparingInt(r -> scale.priority(r.zoneName())));

        checkMonotonic(scale, ordered, label);

        for (int j = 1; j < ordered.size(); j++) {
            ZoneThreshold later = ordered.get(j);
            for (int i = 0; i < j; i++) {
                ZoneThreshold earlier = ordered.get(i);
                if (earlier.interval().encloses(later.interval())) {
                    throw new ThresholdConfigurationException(
                        label + ": zone '" + later.zoneName() + "' is unreachable, its range is covered by '"
                        + earlier.zoneName() + "'");
                }
                if (earlier.comparison() == ComparisonOperator.BETWEEN
                        && later.comparison() == ComparisonOperator.BETWEEN
                        && earlier.interval().intersects(later.interval())) {
                    throw new ThresholdConfigurationException(
                        label + ": ranges of '" + earlier.zoneName() + "' and '" + later.zoneName() + "' overlap");
                }
            }
        }
        return List.copyOf(ordered);
    }

    private static void checkMonotonic(ZoneScale scale, List<ZoneThreshold> ordered, String label) {
        ZoneThreshold prevBull = null;
        ZoneThreshold prevBear = null;
        for (ZoneThreshold row : ordered) {
            Direction side = scale.polarity(row.zoneName());
            if (side == Direction.BUY && row.comparison().hasLowerBound()) {
                if (prevBull != null && row.lowerBound() >= prevBull.lowerBound()) {
                    throw new ThresholdConfigurationException(
                        label + ": bullish zone '" + row.zoneName() + "' starts at " + row.lowerBound()
                        + ", not below more extreme '" + prevBull.zoneName() + "' at " + prevBull.lowerBound());
                }
                prevBull = row;
            } else if (side == Direction.SELL && row.comparison().hasUpperBound()) {
                if (prevBear != null && row.upperBound() <= prevBear.upperBound()) {
                    throw new ThresholdConfigurationException(
                        label + ": bearish zone '" + row.zoneName() + "' ends at " + row.upperBound()
                        + ", not above more extreme '" + prevBear.zoneName() + "' at " + prevBear.upperBound());
                }
                prevBear = row;
            }
        }
    }
}
