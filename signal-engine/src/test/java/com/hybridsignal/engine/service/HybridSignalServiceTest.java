package com.hybridsignal.engine.service;

import com.hybridsignal.core.aggregate.EmissionGate;
import com.hybridsignal.core.aggregate.EmissionPolicy;
import com.hybridsignal.core.aggregate.TimeframeAggregator;
import com.hybridsignal.core.combiner.SignalCombiner;
import com.hybridsignal.core.dedup.CacheEntry;
import com.hybridsignal.core.dedup.DeduplicationCache;
import com.hybridsignal.core.dedup.DeduplicationKey;
import com.hybridsignal.core.dedup.DeduplicationStore;
import com.hybridsignal.core.dedup.DeduplicationStoreException;
import com.hybridsignal.core.dedup.InMemoryDeduplicationStore;
import com.hybridsignal.core.evaluator.MomentumEvaluator;
import com.hybridsignal.core.evaluator.TimingEvaluator;
import com.hybridsignal.core.evaluator.TrendEvaluator;
import com.hybridsignal.core.evaluator.TrendSettings;
import com.hybridsignal.core.model.Direction;
import com.hybridsignal.core.model.IndicatorReading;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.model.SignalType;
import com.hybridsignal.core.publish.SignalRecorder;
import com.hybridsignal.core.zone.ComparisonOperator;
import com.hybridsignal.core.zone.ThresholdBook;
import com.hybridsignal.core.zone.ZoneScale;
import com.hybridsignal.core.zone.ZoneThreshold;
import com.hybridsignal.core.zone.ZoneThresholdMatcher;
import com.hybridsignal.engine.logger.SignalFlowLogger;
import com.hybridsignal.engine.model.EmissionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HybridSignalServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T14:30:00Z");
    private static final List<String> TIMEFRAMES = List.of("15m", "30m", "1h", "4h");

    private ZoneThresholdMatcher matcher;
    private MutableClock clock;
    private List<Signal> recorded;
    private List<Signal> notified;

    @BeforeEach
    void setUp() {
        ThresholdBook.Builder b = ThresholdBook.builder(ZoneScale.DEFAULT).defaultMarket("GLOBAL");
        for (String tf : TIMEFRAMES) {
            for (String indicator : List.of("line", "signal", "histogram")) {
                b.marketThreshold("GLOBAL", row(tf, indicator, "igr", ComparisonOperator.GT, 2.0));
                b.marketThreshold("GLOBAL", row(tf, indicator, "greed", ComparisonOperator.GT, 1.0));
                b.marketThreshold("GLOBAL", row(tf, indicator, "bull", ComparisonOperator.GT, 0.3));
                b.marketThreshold("GLOBAL", row(tf, indicator, "pos", ComparisonOperator.GT, 0.0));
                b.marketThreshold("GLOBAL", row(tf, indicator, "neg", ComparisonOperator.LT, 0.0));
                b.marketThreshold("GLOBAL", row(tf, indicator, "bear", ComparisonOperator.LT, -0.3));
                b.marketThreshold("GLOBAL", row(tf, indicator, "fear", ComparisonOperator.LT, -1.0));
                b.marketThreshold("GLOBAL", row(tf, indicator, "panic", ComparisonOperator.LT, -2.0));
            }
        }
        matcher  = new ZoneThresholdMatcher(b.build());
        clock    = new MutableClock(T0);
        recorded = Collections.synchronizedList(new ArrayList<>());
        notified = Collections.synchronizedList(new ArrayList<>());
    }

    // ── emission ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("emission")
    class Emission {

        @Test
        @DisplayName("agreeing timeframes are emitted once, then suppressed inside the TTL")
        void emitThenSuppress() {
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), timing());
            List<IndicatorReading> readings = List.of(bullish("1h"), bullish("4h"));

            StepVerifier.create(service.evaluate("AAPL", readings))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.EMITTED, outcome.status());
                    assertEquals(Direction.BUY, outcome.aggregated().overallDirection());
                    assertEquals(2, outcome.emitted().size());
                    assertEquals(SignalType.STRONG_BUY, outcome.emitted().get(0).signalType());
                    assertEquals("1h", outcome.emitted().get(0).timeframe());
                    assertEquals("4h", outcome.emitted().get(1).timeframe());
                    assertTrue(outcome.evaluationId().startsWith("AAPL-"));
                })
                .verifyComplete();
            assertEquals(2, recorded.size());
            assertEquals(2, notified.size());

            StepVerifier.create(service.evaluate("AAPL", readings))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.SUPPRESSED, outcome.status());
                    assertEquals(2, outcome.suppressed().size());
                    assertTrue(outcome.emitted().isEmpty());
                })
                .verifyComplete();
            assertEquals(2, recorded.size());

            clock.advance(Duration.ofMinutes(31));
            StepVerifier.create(service.evaluate("AAPL", readings))
                .assertNext(outcome -> assertEquals(EmissionStatus.EMITTED, outcome.status()))
                .verifyComplete();
            assertEquals(4, notified.size());
        }

        @Test
        @DisplayName("readings are merged per timeframe and ordered by the hierarchy")
        void mergedAndOrdered() {
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), timing());
            IndicatorReading trendPart = IndicatorReading.of("AAPL", "1h", T0, Map.of(
                "close", 110.0, "m1", 108.0, "m2", 106.0, "m3", 104.0, "ma144", 100.0));
            IndicatorReading timingPart = IndicatorReading.of("AAPL", "1h", T0, Map.of(
                "macd", 1.5, "signal", 1.2, "histogram", 0.5));

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("4h"), trendPart, timingPart)))
                .assertNext(outcome -> {
                    List<Signal> perTf = outcome.aggregated().perTimeframe();
                    assertEquals(List.of("1h", "4h"), perTf.stream().map(Signal::timeframe).toList());
                    assertEquals(SignalType.STRONG_BUY, perTf.get(0).signalType());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("disagreeing timeframes tie to NEUTRAL and are not emitted")
        void tieNotEmitted() {
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), timing());

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("1h"), bearish("4h"))))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.BELOW_THRESHOLD, outcome.status());
                    assertEquals(Direction.NEUTRAL, outcome.aggregated().overallDirection());
                })
                .verifyComplete();
            assertTrue(notified.isEmpty());
        }

        @Test
        @DisplayName("unanimous policy rejects a 2-of-3 majority")
        void unanimousPolicy() {
            HybridSignalService service = service(TrendSettings.defaults(),
                new EmissionGate(EmissionPolicy.UNANIMOUS, 0.0), timing());

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("30m"), bullish("1h"), bearish("4h"))))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.BELOW_THRESHOLD, outcome.status());
                    assertEquals(Direction.BUY, outcome.aggregated().overallDirection());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no readings → NO_READINGS")
        void noReadings() {
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), timing());

            StepVerifier.create(service.evaluate("AAPL", List.of()))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.NO_READINGS, outcome.status());
                    assertEquals(0.0, outcome.aggregated().overallConfidence());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("readings of another instrument are ignored")
        void foreignReadings() {
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), timing());
            IndicatorReading foreign = IndicatorReading.of("MSFT", "1h", T0, bullish("1h").values());

            StepVerifier.create(service.evaluate("AAPL", List.of(foreign)))
                .assertNext(outcome -> assertEquals(EmissionStatus.NO_READINGS, outcome.status()))
                .verifyComplete();
        }
    }

    // ── failure isolation ───────────────────────────────────────────────────

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("a failing timeframe degrades to NEUTRAL and the rest still emit")
        void failingTimeframe() {
            TimingEvaluator failingOn1h = new TimingEvaluator(matcher) {
                @Override
                public Signal evaluate(IndicatorReading reading) {
                    if ("1h".equals(reading.timeframe())) {
                        throw new IllegalStateException("boom");
                    }
                    return super.evaluate(reading);
                }
            };
            HybridSignalService service = service(TrendSettings.defaults(), EmissionGate.majority(), failingOn1h);

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("30m"), bullish("1h"), bullish("4h"))))
                .assertNext(outcome -> {
                    List<Signal> perTf = outcome.aggregated().perTimeframe();
                    assertEquals(3, perTf.size());
                    assertEquals(Direction.NEUTRAL, perTf.get(1).direction());
                    assertTrue(perTf.get(1).rationale().startsWith("Evaluation failed"));
                    assertEquals(EmissionStatus.EMITTED, outcome.status());
                    assertEquals(List.of("30m", "4h"),
                                 outcome.emitted().stream().map(Signal::timeframe).toList());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a failing recorder does not stop notification")
        void failingRecorder() {
            SignalRecorder broken = signal -> { throw new IllegalStateException("db down"); };
            HybridSignalService service = new HybridSignalService(
                new TrendEvaluator(), timing(), new MomentumEvaluator(matcher), new SignalCombiner(),
                aggregator(), hierarchy(), EmissionGate.majority(), dedup(), broken, notified::add,
                new SignalFlowLogger(), false);

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("1h"))))
                .assertNext(outcome -> assertEquals(EmissionStatus.EMITTED, outcome.status()))
                .verifyComplete();
            assertEquals(1, notified.size());
        }

        @Test
        @DisplayName("an unreachable dedup store fails open and the signal is still emitted")
        void dedupStoreDown() {
            DeduplicationCache failOpen = new DeduplicationCache(new UnreachableStore(), clock,
                                                                 Duration.ofMinutes(30), true);
            HybridSignalService service = new HybridSignalService(
                new TrendEvaluator(), timing(), new MomentumEvaluator(matcher), new SignalCombiner(),
                aggregator(), hierarchy(), EmissionGate.majority(), failOpen, recorded::add, notified::add,
                new SignalFlowLogger(), false);

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("1h"))))
                .assertNext(outcome -> {
                    assertEquals(EmissionStatus.EMITTED, outcome.status());
                    assertEquals(1, outcome.emitted().size());
                })
                .verifyComplete();
            assertEquals(1, notified.size());
        }

        @Test
        @DisplayName("an unreachable dedup store fails closed when configured so")
        void dedupStoreDownFailClosed() {
            DeduplicationCache failClosed = new DeduplicationCache(new UnreachableStore(), clock,
                                                                   Duration.ofMinutes(30), false);
            HybridSignalService service = new HybridSignalService(
                new TrendEvaluator(), timing(), new MomentumEvaluator(matcher), new SignalCombiner(),
                aggregator(), hierarchy(), EmissionGate.majority(), failClosed, recorded::add, notified::add,
                new SignalFlowLogger(), false);

            StepVerifier.create(service.evaluate("AAPL", List.of(bullish("1h"))))
                .assertNext(outcome -> assertEquals(EmissionStatus.SUPPRESSED, outcome.status()))
                .verifyComplete();
            assertTrue(notified.isEmpty());
        }
    }

    // ── trend confirmation ──────────────────────────────────────────────────

    @Nested
    @DisplayName("trend confirmation")
    class Confirmation {

        private final TrendSettings confirmedMode = new TrendSettings(0.05, TrendEvaluator.Mode.CONFIRMED);

        @Test
        @DisplayName("higher timeframe against the trend neutralizes it")
        void contradicted() {
            HybridSignalService service = service(confirmedMode, EmissionGate.majority(), timing());
            Map<String, IndicatorReading> byTf = Map.of("1h", bullish("1h"), "4h", bearish("4h"));

            Signal hybrid = service.evaluateTimeframe("1h", byTf);
            assertEquals(Direction.NEUTRAL, hybrid.components().get(0).direction());
            // timing alone: greed, greed, bull → 0.7 × 0.7
            assertEquals(SignalType.BUY, hybrid.signalType());
            assertEquals(0.49, hybrid.strength(), 1e-9);
        }

        @Test
        @DisplayName("higher timeframe with the trend confirms it")
        void confirmed() {
            HybridSignalService service = service(confirmedMode, EmissionGate.majority(), timing());
            Map<String, IndicatorReading> byTf = Map.of("1h", bullish("1h"), "4h", bullish("4h"));

            assertEquals(SignalType.STRONG_BUY, service.evaluateTimeframe("1h", byTf).signalType());
        }

        @Test
        @DisplayName("only the immediate successor counts; a gap leaves the trend unconfirmed")
        void successorMissing() {
            HybridSignalService service = service(confirmedMode, EmissionGate.majority(), timing());
            // 30m -> 1h in the hierarchy; the bearish 4h reading is not consulted
            Map<String, IndicatorReading> byTf = Map.of("30m", bullish("30m"), "4h", bearish("4h"));

            Signal trend = service.evaluateTimeframe("30m", byTf).components().get(0);
            assertEquals(Direction.BUY, trend.direction());
            assertEquals("N/A", trend.details().get("higherTimeframeConfirmed"));
        }

        @Test
        @DisplayName("top timeframe has nothing to confirm against")
        void topTimeframe() {
            HybridSignalService service = service(confirmedMode, EmissionGate.majority(), timing());
            assertEquals(SignalType.STRONG_BUY,
                service.evaluateTimeframe("4h", Map.of("4h", bullish("4h"))).signalType());
        }
    }

    @Test
    @DisplayName("momentum enabled switches to the three-way combination")
    void momentumEnabled() {
        HybridSignalService service = new HybridSignalService(
            new TrendEvaluator(), timing(), new MomentumEvaluator(matcher), new SignalCombiner(),
            aggregator(), hierarchy(), EmissionGate.majority(), dedup(), recorded::add, notified::add,
            new SignalFlowLogger(), true);

        Signal hybrid = service.evaluateTimeframe("1h", Map.of("1h", bullish("1h")));
        assertEquals(3, hybrid.components().size());
        // no bars thresholds: momentum is NEUTRAL, trend and timing carry a 2-of-3 BUY
        assertEquals(SignalType.BUY, hybrid.signalType());
    }

    // ── fixtures ────────────────────────────────────────────────────────────

    private HybridSignalService service(TrendSettings trendSettings, EmissionGate gate, TimingEvaluator timing) {
        return new HybridSignalService(
            new TrendEvaluator(trendSettings), timing, new MomentumEvaluator(matcher), new SignalCombiner(),
            aggregator(), hierarchy(), gate, dedup(), recorded::add, notified::add,
            new SignalFlowLogger(), false);
    }

    private TimingEvaluator timing() {
        return new TimingEvaluator(matcher);
    }

    private DeduplicationCache dedup() {
        return new DeduplicationCache(new InMemoryDeduplicationStore(), clock, Duration.ofMinutes(30), true);
    }

    private static TimeframeHierarchy hierarchy() {
        return TimeframeHierarchy.parse("1m:1,2m:2,5m:3,15m:4,30m:5,1h:6,4h:7");
    }

    private static TimeframeAggregator aggregator() {
        return new TimeframeAggregator(hierarchy().weights());
    }

    private static IndicatorReading bullish(String timeframe) {
        return IndicatorReading.of("AAPL", timeframe, T0, Map.of(
            "close", 110.0, "m1", 108.0, "m2", 106.0, "m3", 104.0, "ma144", 100.0,
            "macd", 1.5, "signal", 1.2, "histogram", 0.5));
    }

    private static IndicatorReading bearish(String timeframe) {
        return IndicatorReading.of("AAPL", timeframe, T0, Map.of(
            "close", 90.0, "m1", 92.0, "m2", 94.0, "m3", 96.0, "ma144", 100.0,
            "macd", -1.5, "signal", -1.2, "histogram", -0.5));
    }

    private static final class UnreachableStore implements DeduplicationStore {

        @Override
        public boolean tryAcquire(DeduplicationKey key, Instant now, Duration ttl) {
            throw new DeduplicationStoreException("store unreachable");
        }

        @Override
        public Optional<CacheEntry> find(DeduplicationKey key) {
            throw new DeduplicationStoreException("store unreachable");
        }

        @Override
        public int size() {
            throw new DeduplicationStoreException("store unreachable");
        }
    }

    private static ZoneThreshold row(String tf, String indicator, String zone, ComparisonOperator op, double min) {
        return ZoneThreshold.of("GLOBAL", tf, indicator, zone, op, min, null);
    }
}
