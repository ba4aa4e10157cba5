package com.title.reconciliation.cache;

import java.time.Duration;

/**
 * How model answers are kept between requests of one engine.
 * Limits are only checked for an enabled cache; a disabled one carries none.
 *
 * @param enabled whether clean resolutions are cached
 * @param maxSize entry bound, evicting least recently used answers past it
 * @param ttl     how long an answer stays valid after it was stored
 */
public record CacheConfig(boolean enabled, int maxSize, Duration ttl) {

    public static final int DEFAULT_MAX_SIZE = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public CacheConfig {
        if (enabled) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("cache maxSize must be > 0");
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("cache ttl must be positive");
            }
        } else {
            maxSize = 0;
            ttl = Duration.ZERO;
        }
    }

    /**
     * An enabled cache with the given limits.
     */
    public static CacheConfig of(int maxSize, Duration ttl) {
        return new CacheConfig(true, maxSize, ttl);
    }

    public static CacheConfig defaults() {
        return of(DEFAULT_MAX_SIZE, DEFAULT_TTL);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(false, 0, Duration.ZERO);
    }
}
