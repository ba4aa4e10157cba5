package com.title.reconciliation.core.model;

import java.util.Objects;

/**
 * Canonical company identity used for grouping and comparison.
 *
 * @param value the normalized key text, never null
 * @param basis which input the key was derived from
 */
public record NormalizedKey(String value, Basis basis) {

    public enum Basis {
        DOMAIN,
        NAME,
        EMPTY
    }

    private static final NormalizedKey EMPTY_KEY = new NormalizedKey("", Basis.EMPTY);

    public NormalizedKey {
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(basis, "basis is required");
    }

    public static NormalizedKey empty() {
        return EMPTY_KEY;
    }

    public static NormalizedKey ofDomain(String domain) {
        return new NormalizedKey(domain, Basis.DOMAIN);
    }

    public static NormalizedKey ofName(String name) {
        return name.isEmpty() ? EMPTY_KEY : new NormalizedKey(name, Basis.NAME);
    }

    public boolean isEmpty() {
        return basis == Basis.EMPTY;
    }

    @Override
    public String toString() {
        return isEmpty() ? "<empty>" : basis.name().toLowerCase() + ":" + value;
    }
}
