package com.title.reconciliation.cache;

import com.title.reconciliation.core.model.ResolutionResult;

import java.util.Optional;

/**
 * Cache that never stores anything.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionResult> get(ResolutionCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(ResolutionCacheKey key, ResolutionResult result) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public long size() {
        return 0;
    }
}
