package com.title.reconciliation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.title.reconciliation.core.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed resolution cache.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<ResolutionCacheKey, ResolutionResult> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttl().toSeconds());
    }

    @Override
    public Optional<ResolutionResult> get(ResolutionCacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(ResolutionCacheKey key, ResolutionResult result) {
        if (result.isFailure()) {
            return;
        }
        cache.put(key, result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
