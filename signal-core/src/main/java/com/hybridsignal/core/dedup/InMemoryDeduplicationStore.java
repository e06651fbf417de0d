package com.hybridsignal.core.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DeduplicationStore} over a {@link ConcurrentHashMap}.
 *
 * <p>Check-and-stamp runs inside {@link ConcurrentHashMap#compute}, so two concurrent callers
 * for the same key never both acquire it. An expired entry is overwritten by the next
 * acquisition of its key; nothing sweeps the map.
 */
public class InMemoryDeduplicationStore implements DeduplicationStore {

    private final ConcurrentHashMap<DeduplicationKey, CacheEntry> store = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(DeduplicationKey key, Instant now, Duration ttl) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        store.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            acquired.set(true);
            return CacheEntry.of(k, now, ttl);
        });
        return acquired.get();
    }

    @Override
    public Optional<CacheEntry> find(DeduplicationKey key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public int size() {
        return store.size();
    }
}
