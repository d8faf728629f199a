package com.z254.arbiter.store.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine caches whose expiry follows the injected clock.
 */
final class MemoryCaches {

    private MemoryCaches() {
    }

    /**
     * Entries expire {@code ttl} after they were written. Maintenance runs on
     * the calling thread so expiry is observable immediately after the clock moves.
     */
    static <V> Cache<String, V> expiring(Clock clock, Duration ttl, long maximumSize) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(() -> nanos(clock.instant()))
                .executor(Runnable::run)
                .build();
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
