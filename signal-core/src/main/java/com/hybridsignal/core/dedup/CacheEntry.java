package com.hybridsignal.core.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Last emission of a {@link DeduplicationKey}. An entry is live while
 * {@code now < lastEmittedAt + ttl}.
 */
public record CacheEntry(
    @JsonProperty("key") DeduplicationKey key,
    @JsonProperty("lastEmittedAt") Instant lastEmittedAt,
    @JsonProperty("ttl") Duration ttl
) {

    public static CacheEntry of(DeduplicationKey key, Instant lastEmittedAt, Duration ttl) {
        return new CacheEntry(key, lastEmittedAt, ttl);
    }

    public Instant expiresAt() {
        return lastEmittedAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
