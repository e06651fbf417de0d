package com.hybridsignal.core.dedup;

import com.hybridsignal.core.model.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Suppresses repeat notifications of the same (instrument, signal type, timeframe) within a
 * time-to-live window.
 *
 * <ul>
 *   <li>live entry for the key → {@code false}, entry untouched</li>
 *   <li>no entry, or expired entry → {@code true}, entry stamped with {@code clock.instant()}</li>
 *   <li>store failure → {@code failOpen}</li>
 * </ul>
 *
 * <p>Only an allowed emission stamps the key, so a suppressed call never extends the window.
 * Time comes exclusively from the injected {@link Clock}.
 */
public class DeduplicationCache {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final DeduplicationStore store;
    private final Clock clock;
    private final Duration ttl;
    private final boolean failOpen;

    public DeduplicationCache(DeduplicationStore store, Clock clock, Duration ttl, boolean failOpen) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        this.store = store;
        this.clock = clock;
        this.ttl = ttl;
        this.failOpen = failOpen;
    }

    public DeduplicationCache(Clock clock) {
        this(new InMemoryDeduplicationStore(), clock, DEFAULT_TTL, true);
    }

    public boolean shouldEmit(String instrumentId, SignalType signalType, String timeframe) {
        DeduplicationKey key = DeduplicationKey.of(instrumentId, signalType, timeframe);
        Instant now = clock.instant();
        try {
            boolean allowed = store.tryAcquire(key, now, ttl);
            if (allowed) {
                log.debug("DEDUP_ALLOW key={} expiresAt={}", key, now.plus(ttl));
            } else {
                log.info("DEDUP_SUPPRESS key={} ttlMinutes={}", key, ttl.toMinutes());
            }
            return allowed;
        } catch (DeduplicationStoreException e) {
            log.warn("DEDUP_STORE_FAILURE key={} failOpen={} reason={}", key, failOpen, e.getMessage());
            return failOpen;
        }
    }

    public Duration ttl() {
        return ttl;
    }

    public boolean isFailOpen() {
        return failOpen;
    }
}
