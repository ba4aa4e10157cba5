package com.title.reconciliation.core.model;

/**
 * Prompting mode used when asking the model to resolve a title.
 */
public enum ResolutionMode {
    EXTRAPOLATE("extrapolate"),
    ARBITRATE("arbitrate");

    private final String value;

    ResolutionMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
