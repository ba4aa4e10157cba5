package com.title.reconciliation.rules;

import com.title.reconciliation.core.model.NormalizedKey;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes company names and domains into a {@link NormalizedKey}.
 *
 * <p>A well-formed domain is preferred over the name when both are present.
 * Pure and side-effect free: malformed input degrades to a best-effort key and never throws.
 * Normalizing the value of an already-normalized key returns the same key.</p>
 */
public class CompanyNormalizer {
    private static final int MAX_PASSES = 4;

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern WELL_FORMED_DOMAIN = Pattern.compile(
            "^(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    private final NormalizationEngine engine;

    public CompanyNormalizer() {
        this(CompanyNormalizationRules.createEngine());
    }

    public CompanyNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Normalizes a company identity. The domain wins when it is well-formed.
     *
     * @param companyName company name, may be null
     * @param domain      company domain, URL or email address, may be null
     * @return the key, {@link NormalizedKey#empty()} when neither input is usable
     */
    public NormalizedKey normalize(String companyName, String domain) {
        Optional<String> normalizedDomain = normalizeDomain(domain);
        if (normalizedDomain.isPresent()) {
            return NormalizedKey.ofDomain(normalizedDomain.get());
        }
        return NormalizedKey.ofName(normalizeName(companyName));
    }

    /**
     * Normalizes the value of an existing key with the same basis.
     */
    public NormalizedKey normalize(NormalizedKey key) {
        return switch (key.basis()) {
            case DOMAIN -> normalize(null, key.value());
            case NAME -> normalize(key.value(), null);
            case EMPTY -> NormalizedKey.empty();
        };
    }

    /**
     * Normalizes a company name: lower-cased, legal suffixes and punctuation removed.
     * Rules are re-run until the output is stable.
     */
    public String normalizeName(String companyName) {
        String current = engine.normalize(companyName);
        for (int i = 0; i < MAX_PASSES; i++) {
            String next = engine.normalize(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    /**
     * Normalizes a domain, URL or email address to a bare host name.
     *
     * @return the host, or empty when the input is not a well-formed domain
     */
    public Optional<String> normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        String host = domain.trim().toLowerCase(Locale.ROOT);
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        host = SCHEME.matcher(host).replaceFirst("");
        host = cutAt(host, '/');
        host = cutAt(host, '?');
        host = cutAt(host, '#');
        host = cutAt(host, ':');
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return WELL_FORMED_DOMAIN.matcher(host).matches() ? Optional.of(host) : Optional.empty();
    }

    private static String cutAt(String value, char delimiter) {
        int index = value.indexOf(delimiter);
        return index >= 0 ? value.substring(0, index) : value;
    }
}
