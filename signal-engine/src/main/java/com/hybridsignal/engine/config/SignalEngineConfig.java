package com.hybridsignal.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hybridsignal.core.aggregate.EmissionGate;
import com.hybridsignal.core.aggregate.EmissionPolicy;
import com.hybridsignal.core.aggregate.TimeframeAggregator;
import com.hybridsignal.core.combiner.CombinerSettings;
import com.hybridsignal.core.combiner.SignalCombiner;
import com.hybridsignal.core.dedup.DeduplicationCache;
import com.hybridsignal.core.dedup.DeduplicationStore;
import com.hybridsignal.core.dedup.InMemoryDeduplicationStore;
import com.hybridsignal.core.evaluator.MomentumEvaluator;
import com.hybridsignal.core.evaluator.TimingEvaluator;
import com.hybridsignal.core.evaluator.TimingSettings;
import com.hybridsignal.core.evaluator.TrendEvaluator;
import com.hybridsignal.core.evaluator.TrendSettings;
import com.hybridsignal.core.publish.SignalNotifier;
import com.hybridsignal.core.publish.SignalRecorder;
import com.hybridsignal.core.zone.ThresholdBook;
import com.hybridsignal.core.zone.ZoneThresholdMatcher;
import com.hybridsignal.engine.publisher.LoggingSignalNotifier;
import com.hybridsignal.engine.publisher.LoggingSignalRecorder;
import com.hybridsignal.engine.service.TimeframeHierarchy;
import com.hybridsignal.engine.threshold.YamlThresholdLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

@Configuration
public class SignalEngineConfig {

    @Value("${signal-engine.thresholds.location:classpath:thresholds.yml}")
    private String thresholdsLocation;

    @Value("${signal-engine.timeframes.hierarchy:1m:1,2m:2,5m:3,15m:4,30m:5,1h:6,4h:7}")
    private String timeframeHierarchy;

    @Value("${signal-engine.trend.normalization-spread:0.05}")
    private double trendNormalizationSpread;

    @Value("${signal-engine.trend.mode:LOCAL}")
    private String trendMode;

    @Value("${signal-engine.timing.weights.line:0.4}")
    private double timingLineWeight;

    @Value("${signal-engine.timing.weights.signal:0.4}")
    private double timingSignalWeight;

    @Value("${signal-engine.timing.weights.histogram:0.2}")
    private double timingHistogramWeight;

    @Value("${signal-engine.combiner.single-indicator-factor:0.7}")
    private double singleIndicatorFactor;

    @Value("${signal-engine.combiner.conflict-factor:0.3}")
    private double conflictFactor;

    @Value("${signal-engine.combiner.majority-factor:0.8}")
    private double majorityFactor;

    @Value("${signal-engine.combiner.weak-majority-ratio:1.0}")
    private double weakMajorityRatio;

    @Value("${signal-engine.combiner.agreement-bonus:0.2}")
    private double agreementBonus;

    @Value("${signal-engine.combiner.conflict-penalty:0.3}")
    private double conflictPenalty;

    @Value("${signal-engine.emission.policy:MAJORITY}")
    private String emissionPolicy;

    @Value("${signal-engine.emission.min-confidence:0.0}")
    private double minConfidence;

    @Value("${signal-engine.dedup.ttl-minutes:30}")
    private long dedupTtlMinutes;

    @Value("${signal-engine.dedup.fail-open:true}")
    private boolean dedupFailOpen;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── thresholds & evaluators ─────────────────────────────────────────────

    @Bean
    public ThresholdBook thresholdBook(ResourceLoader resourceLoader) {
        return new YamlThresholdLoader(resourceLoader).load(thresholdsLocation);
    }

    @Bean
    public ZoneThresholdMatcher zoneThresholdMatcher(ThresholdBook thresholdBook) {
        return new ZoneThresholdMatcher(thresholdBook);
    }

    @Bean
    public TrendEvaluator trendEvaluator() {
        TrendEvaluator.Mode mode = TrendEvaluator.Mode.valueOf(trendMode.trim().toUpperCase(Locale.ROOT));
        return new TrendEvaluator(new TrendSettings(trendNormalizationSpread, mode));
    }

    @Bean
    public TimingEvaluator timingEvaluator(ZoneThresholdMatcher matcher) {
        return new TimingEvaluator(matcher,
            new TimingSettings(timingLineWeight, timingSignalWeight, timingHistogramWeight));
    }

    @Bean
    public MomentumEvaluator momentumEvaluator(ZoneThresholdMatcher matcher) {
        return new MomentumEvaluator(matcher);
    }

    // ── combination, aggregation, gate ──────────────────────────────────────

    @Bean
    public SignalCombiner signalCombiner() {
        return new SignalCombiner(new CombinerSettings(
            singleIndicatorFactor, conflictFactor, majorityFactor,
            weakMajorityRatio, agreementBonus, conflictPenalty));
    }

    @Bean
    public TimeframeHierarchy timeframeHierarchy() {
        return TimeframeHierarchy.parse(timeframeHierarchy);
    }

    @Bean
    public TimeframeAggregator timeframeAggregator(TimeframeHierarchy hierarchy) {
        return new TimeframeAggregator(hierarchy.weights());
    }

    @Bean
    public EmissionGate emissionGate() {
        EmissionPolicy policy = EmissionPolicy.valueOf(emissionPolicy.trim().toUpperCase(Locale.ROOT));
        return new EmissionGate(policy, minConfidence);
    }

    // ── dedup & publishing ──────────────────────────────────────────────────

    @Bean
    public DeduplicationStore deduplicationStore() {
        return new InMemoryDeduplicationStore();
    }

    @Bean
    public DeduplicationCache deduplicationCache(DeduplicationStore store, Clock clock) {
        return new DeduplicationCache(store, clock, Duration.ofMinutes(dedupTtlMinutes), dedupFailOpen);
    }

    @Bean
    public SignalRecorder signalRecorder(ObjectMapper objectMapper) {
        return new LoggingSignalRecorder(objectMapper);
    }

    @Bean
    public SignalNotifier signalNotifier() {
        return new LoggingSignalNotifier();
    }
}
