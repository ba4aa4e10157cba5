package com.title.reconciliation.cache;

import com.title.reconciliation.core.model.ResolutionMode;

import java.util.Objects;

/**
 * Identity of a resolution request. Two records with the same key would be sent
 * the same prompt, so they can share one answer.
 */
public record ResolutionCacheKey(ResolutionMode mode, String titleInput, String titleNew, String companyKey) {

    public ResolutionCacheKey {
        Objects.requireNonNull(mode, "mode is required");
        titleInput = titleInput != null ? titleInput : "";
        titleNew = titleNew != null ? titleNew : "";
        companyKey = companyKey != null ? companyKey : "";
    }
}
