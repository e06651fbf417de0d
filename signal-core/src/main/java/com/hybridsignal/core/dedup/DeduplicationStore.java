package com.hybridsignal.core.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Backing store for {@link DeduplicationCache}.
 *
 * <p>Current implementation: {@link InMemoryDeduplicationStore}. A shared store (for several
 * engine instances) only has to honour the same atomic check-and-stamp contract.
 */
public interface DeduplicationStore {

    /**
     * Atomically checks {@code key} and stamps it when free.
     *
     * @return {@code true} when no live entry existed and a new one stamped at {@code now}
     *         was stored; {@code false} when a live entry suppresses the key
     * @throws DeduplicationStoreException when the store cannot answer
     */
    boolean tryAcquire(DeduplicationKey key, Instant now, Duration ttl);

    /** Current entry for {@code key}, expired or not. */
    Optional<CacheEntry> find(DeduplicationKey key);

    int size();
}
