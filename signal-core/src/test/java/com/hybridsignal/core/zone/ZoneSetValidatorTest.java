package com.hybridsignal.core.zone;

import com.hybridsignal.core.exception.ThresholdConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Load-time rejection of ambiguous zone sets.
 */
class ZoneSetValidatorTest {

    private static final ZoneScale SCALE = ZoneScale.DEFAULT;

    @Test
    @DisplayName("valid set is returned in evaluation order")
    void validSetIsOrdered() {
        List<ZoneThreshold> rows = List.of(
            gt("pos", 0.0), lt("bear", -0.3), gt("igr", 2.0), lt("panic", -2.0), gt("bull", 0.3));
        List<ZoneThreshold> ordered = ZoneSetValidator.validate(SCALE, rows, "test");
        assertEquals(List.of("igr", "panic", "bull", "bear", "pos"),
                     ordered.stream().map(ZoneThreshold::zoneName).toList());
    }

    @Test
    @DisplayName("zone outside the scale is rejected")
    void unknownZone() {
        ThresholdConfigurationException e = assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(gt("moon", 1.0)), "test"));
        assertTrue(e.getMessage().contains("moon"));
    }

    @Test
    @DisplayName("duplicate zone is rejected")
    void duplicateZone() {
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(gt("bull", 1.0), gt("bull", 2.0)), "test"));
    }

    @Test
    @DisplayName("bullish bounds must decrease towards neutral")
    void bullishNotMonotonic() {
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(gt("igr", 1.0), gt("greed", 2.0)), "test"));
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(gt("igr", 1.0), gt("greed", 1.0)), "test"));
    }

    @Test
    @DisplayName("bearish bounds must increase towards neutral")
    void bearishNotMonotonic() {
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(lt("panic", -1.0), lt("fear", -2.0)), "test"));
    }

    @Test
    @DisplayName("zone covered by a more extreme zone is unreachable")
    void unreachableZone() {
        ZoneThreshold shadowed = ZoneThreshold.of("X", "1h", "line", "pos", ComparisonOperator.BETWEEN, -1.0, -0.5);
        ThresholdConfigurationException e = assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(lt("bear", -0.3), shadowed), "test"));
        assertTrue(e.getMessage().contains("unreachable"));
    }

    @Test
    @DisplayName("intersecting between ranges are rejected")
    void overlappingBetween() {
        ZoneThreshold greed = ZoneThreshold.of("X", "1h", "line", "greed", ComparisonOperator.BETWEEN, 1.0, 3.0);
        ZoneThreshold bull  = ZoneThreshold.of("X", "1h", "line", "bull", ComparisonOperator.BETWEEN, 0.5, 1.5);
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneSetValidator.validate(SCALE, List.of(greed, bull), "test"));
    }

    @Test
    @DisplayName("adjacent between ranges sharing no point are accepted")
    void adjacentBetween() {
        ZoneThreshold bull = ZoneThreshold.of("X", "1h", "line", "bull", ComparisonOperator.BETWEEN, 1.0, 2.0);
        ZoneThreshold pos  = ZoneThreshold.of("X", "1h", "line", "pos", ComparisonOperator.BETWEEN, 0.0, 0.99);
        assertEquals(2, ZoneSetValidator.validate(SCALE, List.of(pos, bull), "test").size());
    }

    @Test
    @DisplayName("between with max below min or without max is rejected on construction")
    void malformedBetween() {
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneThreshold.of("X", "1h", "line", "bull", ComparisonOperator.BETWEEN, 2.0, 1.0));
        assertThrows(ThresholdConfigurationException.class,
            () -> ZoneThreshold.of("X", "1h", "line", "bull", ComparisonOperator.BETWEEN, 2.0, null));
    }

    @Test
    @DisplayName("comparison symbols parse; unknown ones are rejected")
    void comparisonSymbols() {
        assertEquals(ComparisonOperator.GTE, ComparisonOperator.fromSymbol(">="));
        assertEquals(ComparisonOperator.BETWEEN, ComparisonOperator.fromSymbol("Between"));
        assertEquals(ComparisonOperator.LT, ComparisonOperator.fromSymbol("LT"));
        assertThrows(ThresholdConfigurationException.class, () -> ComparisonOperator.fromSymbol("~"));
        assertThrows(ThresholdConfigurationException.class, () -> ComparisonOperator.fromSymbol(null));
    }

    @Test
    @DisplayName("builder validates every key")
    void builderValidates() {
        ThresholdBook.Builder builder = ThresholdBook.builder(SCALE)
            .instrumentThreshold(gt("bull", 1.0))
            .instrumentThreshold(gt("bull", 2.0));
        assertThrows(ThresholdConfigurationException.class, builder::build);
    }

    private static ZoneThreshold gt(String zone, double min) {
        return ZoneThreshold.of("X", "1h", "line", zone, ComparisonOperator.GT, min, null);
    }

    private static ZoneThreshold lt(String zone, double min) {
        return ZoneThreshold.of("X", "1h", "line", zone, ComparisonOperator.LT, min, null);
    }
}
