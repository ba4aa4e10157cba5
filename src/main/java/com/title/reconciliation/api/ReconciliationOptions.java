package com.title.reconciliation.api;

import com.title.reconciliation.cache.CacheConfig;
import com.title.reconciliation.job.JobOrchestrator;
import com.title.reconciliation.job.SetupException;
import com.title.reconciliation.llm.ModelResponseParser;
import com.title.reconciliation.llm.RetryPolicy;
import com.title.reconciliation.llm.TitleResolver;

import java.time.Duration;
import java.util.Properties;

/**
 * Options for a reconciliation engine: worker pool size, model call limits and caching.
 */
public class ReconciliationOptions {

    public static final String PREFIX = "reconciliation.";

    private final int maxConcurrency;
    private final Duration llmTimeout;
    private final RetryPolicy retryPolicy;
    private final double defaultConfidence;
    private final int maxTitleLength;
    private final int progressInterval;
    private final CacheConfig cacheConfig;

    private ReconciliationOptions(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.llmTimeout = builder.llmTimeout;
        this.retryPolicy = builder.retryPolicy;
        this.defaultConfidence = builder.defaultConfidence;
        this.maxTitleLength = builder.maxTitleLength;
        this.progressInterval = builder.progressInterval;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from {@code reconciliation.*} keys. Missing keys keep their defaults.
     *
     * <pre>
     * reconciliation.max-concurrency=5
     * reconciliation.llm-timeout-ms=30000
     * reconciliation.retry.max-attempts=3
     * reconciliation.retry.initial-backoff-ms=4000
     * reconciliation.retry.max-backoff-ms=10000
     * reconciliation.retry.multiplier=2.0
     * reconciliation.default-confidence=0.5
     * reconciliation.max-title-length=120
     * reconciliation.progress-interval=100
     * reconciliation.cache.enabled=true
     * reconciliation.cache.max-size=10000
     * reconciliation.cache.ttl-seconds=3600
     * </pre>
     *
     * @throws SetupException when a value is malformed or out of range
     */
    public static ReconciliationOptions fromProperties(Properties properties) {
        ReconciliationOptions defaults = defaults();
        RetryPolicy retry = defaults.getRetryPolicy();
        CacheConfig cache = defaults.getCacheConfig();
        try {
            RetryPolicy retryPolicy = new RetryPolicy(
                    intValue(properties, "retry.max-attempts", retry.maxAttempts()),
                    Duration.ofMillis(longValue(properties, "retry.initial-backoff-ms", retry.initialBackoff().toMillis())),
                    Duration.ofMillis(longValue(properties, "retry.max-backoff-ms", retry.maxBackoff().toMillis())),
                    doubleValue(properties, "retry.multiplier", retry.multiplier()));
            CacheConfig cacheConfig = new CacheConfig(
                    booleanValue(properties, "cache.enabled", cache.enabled()),
                    intValue(properties, "cache.max-size", cache.maxSize()),
                    Duration.ofSeconds(longValue(properties, "cache.ttl-seconds", cache.ttl().toSeconds())));

            return builder()
                    .maxConcurrency(intValue(properties, "max-concurrency", defaults.getMaxConcurrency()))
                    .llmTimeout(Duration.ofMillis(longValue(properties, "llm-timeout-ms", defaults.getLlmTimeout().toMillis())))
                    .retryPolicy(retryPolicy)
                    .defaultConfidence(doubleValue(properties, "default-confidence", defaults.getDefaultConfidence()))
                    .maxTitleLength(intValue(properties, "max-title-length", defaults.getMaxTitleLength()))
                    .progressInterval(intValue(properties, "progress-interval", defaults.getProgressInterval()))
                    .cacheConfig(cacheConfig)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SetupException("Invalid reconciliation configuration: " + e.getMessage(), e);
        }
    }

    private static String raw(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(PREFIX + key + " is not a boolean: " + value);
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{maxConcurrency=" + maxConcurrency +
                ", llmTimeout=" + llmTimeout +
                ", retryPolicy=" + retryPolicy +
                ", defaultConfidence=" + defaultConfidence +
                ", maxTitleLength=" + maxTitleLength +
                ", progressInterval=" + progressInterval +
                ", cacheConfig=" + cacheConfig + '}';
    }

    public static class Builder {
        private int maxConcurrency = JobOrchestrator.DEFAULT_MAX_CONCURRENCY;
        private Duration llmTimeout = TitleResolver.DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private double defaultConfidence = TitleResolver.DEFAULT_CONFIDENCE;
        private int maxTitleLength = ModelResponseParser.DEFAULT_MAX_TITLE_LENGTH;
        private int progressInterval = JobOrchestrator.DEFAULT_PROGRESS_INTERVAL;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder llmTimeout(Duration llmTimeout) {
            if (llmTimeout == null || llmTimeout.isZero() || llmTimeout.isNegative()) {
                throw new IllegalArgumentException("llmTimeout must be positive");
            }
            this.llmTimeout = llmTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            if (retryPolicy == null) {
                throw new IllegalArgumentException("retryPolicy is required");
            }
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder defaultConfidence(double defaultConfidence) {
            if (defaultConfidence < 0.0 || defaultConfidence > 1.0) {
                throw new IllegalArgumentException("defaultConfidence must be between 0.0 and 1.0");
            }
            this.defaultConfidence = defaultConfidence;
            return this;
        }

        public Builder maxTitleLength(int maxTitleLength) {
            if (maxTitleLength <= 0) {
                throw new IllegalArgumentException("maxTitleLength must be > 0");
            }
            this.maxTitleLength = maxTitleLength;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be > 0");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }
}
