package com.title.reconciliation.cache;

import com.title.reconciliation.core.model.ResolutionResult;

import java.util.Optional;

/**
 * Cache of model answers keyed by request identity.
 * The resolver stores clean resolutions only; provider failures are never cached.
 */
public interface ResolutionCache {

    Optional<ResolutionResult> get(ResolutionCacheKey key);

    void put(ResolutionCacheKey key, ResolutionResult result);

    void invalidateAll();

    long size();

    /**
     * Creates a cache for the given configuration, or a no-op cache when disabled.
     */
    static ResolutionCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResolutionCache(config) : new NoOpResolutionCache();
    }
}
