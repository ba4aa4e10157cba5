package com.title.reconciliation.llm;

import com.title.reconciliation.cache.NoOpResolutionCache;
import com.title.reconciliation.cache.ResolutionCache;
import com.title.reconciliation.cache.ResolutionCacheKey;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionMode;
import com.title.reconciliation.core.model.ResolutionOutcome;
import com.title.reconciliation.core.model.ResolutionResult;
import com.title.reconciliation.metrics.MetricsService;
import com.title.reconciliation.metrics.NoOpMetricsService;
import com.title.reconciliation.rules.CompanyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Resolves one person's title through the {@link LLMProvider}.
 *
 * <p>Each attempt is bounded by the call timeout. Transient failures are retried following the
 * {@link RetryPolicy}; once attempts run out the result asks for manual review. A malformed answer
 * is treated like an explicit {@code REVIEW_MANUAL} and is not retried.
 * {@link #resolve(PersonRecord, ResolutionMode)} never throws.</p>
 *
 * <p>Thread-safe. Calls from different workers are independent. At most
 * {@code maxConcurrentCalls} provider calls run at once; a call abandoned on timeout keeps its
 * slot until the provider returns.</p>
 */
public class TitleResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TitleResolver.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 5;

    private final LLMProvider provider;
    private final ModelResponseParser parser;
    private final TitlePromptBuilder promptBuilder;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final double defaultConfidence;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final Sleeper sleeper;
    private final CompanyNormalizer normalizer;
    private final int maxConcurrentCalls;
    private final ExecutorService callExecutor;

    private TitleResolver(Builder builder) {
        this.provider = builder.provider;
        this.parser = builder.parser;
        this.promptBuilder = builder.promptBuilder;
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
        this.defaultConfidence = builder.defaultConfidence;
        this.cache = builder.cache;
        this.metrics = builder.metrics;
        this.sleeper = builder.sleeper;
        this.normalizer = builder.normalizer;
        this.maxConcurrentCalls = builder.maxConcurrentCalls;
        this.callExecutor = Executors.newFixedThreadPool(maxConcurrentCalls, new CallThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the title for a triggered record.
     *
     * @param person the record
     * @param mode   extrapolate for a missing internal title, arbitrate for a collision
     * @return the resolution; failures are expressed in the result, never thrown
     */
    public ResolutionResult resolve(PersonRecord person, ResolutionMode mode) {
        return resolve(person, mode, () -> false);
    }

    /**
     * Resolves the title, giving up before any retry once {@code cancelled} reports true.
     * A call already in flight is left to finish or time out.
     */
    public ResolutionResult resolve(PersonRecord person, ResolutionMode mode, BooleanSupplier cancelled) {
        Objects.requireNonNull(person, "person is required");
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(cancelled, "cancelled is required");

        ResolutionCacheKey key = cacheKey(person, mode);
        Optional<ResolutionResult> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            log.debug("llm.cache.hit personId={} mode={}", person.personId(), mode.getValue());
            return cached.get().asCached();
        }
        metrics.recordCacheMiss();

        long start = System.nanoTime();
        ResolutionResult result = callWithRetries(person, promptBuilder.build(person, mode), cancelled);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        metrics.recordResolution(result.outcome(), elapsed);
        if (result.outcome() == ResolutionOutcome.RESOLVED) {
            cache.put(key, result);
        }
        log.info("llm.resolution.completed personId={} mode={} outcome={} attempts={} durationMs={}",
                person.personId(), mode.getValue(), result.outcome(), result.attempts(), elapsed.toMillis());
        return result;
    }

    private ResolutionResult callWithRetries(PersonRecord person, String prompt, BooleanSupplier cancelled) {
        RetryStateMachine machine = new RetryStateMachine(retryPolicy);
        while (true) {
            LLMCompletion completion;
            try {
                completion = callWithTimeout(prompt);
            } catch (TransientProviderException e) {
                if (machine.onTransientFailure() == RetryState.GIVE_UP) {
                    log.warn("llm.retries.exhausted personId={} attempts={} reason={}",
                            person.personId(), machine.attempt(), e.getReason());
                    return ResolutionResult.retriesExhausted(machine.attempt());
                }
                if (cancelled.getAsBoolean()) {
                    return abandonCancelled(person, machine);
                }
                Duration backoff = machine.backoff();
                metrics.incrementRetries();
                log.warn("llm.call.transient personId={} attempt={} reason={} backoffMs={}",
                        person.personId(), machine.attempt(), e.getReason(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    machine.onInterrupted();
                    log.warn("llm.retry.interrupted personId={} attempts={}", person.personId(), machine.attempt());
                    return ResolutionResult.retriesExhausted(machine.attempt());
                }
                if (cancelled.getAsBoolean()) {
                    return abandonCancelled(person, machine);
                }
                machine.onWaitElapsed();
                continue;
            } catch (RuntimeException e) {
                log.error("llm.call.failed personId={} attempt={} error={}",
                        person.personId(), machine.attempt(), e.toString());
                return ResolutionResult.providerError(e.getMessage(), machine.attempt());
            }
            machine.onSuccess();
            return decode(completion, machine.attempt());
        }
    }

    private ResolutionResult abandonCancelled(PersonRecord person, RetryStateMachine machine) {
        machine.onCancelled();
        log.info("llm.retry.cancelled personId={} attempts={}", person.personId(), machine.attempt());
        return ResolutionResult.retriesExhausted(machine.attempt());
    }

    private LLMCompletion callWithTimeout(String prompt) {
        Future<LLMCompletion> future = callExecutor.submit(() -> provider.complete(prompt, timeout));
        try {
            LLMCompletion completion = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (completion == null) {
                throw new IllegalStateException("Provider " + provider.getProviderName() + " returned no completion");
            }
            return completion;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException(TransientProviderException.Reason.TIMEOUT,
                    "Provider call exceeded " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientProviderException(TransientProviderException.Reason.UNAVAILABLE,
                    "Interrupted while waiting for provider", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Provider call failed", cause);
        }
    }

    private ResolutionResult decode(LLMCompletion completion, int attempts) {
        String raw = completion.text();
        ModelResponse response = parser.parse(raw);
        double confidence = confidence(completion, response);
        return switch (response.kind()) {
            case CLEAN_TITLE -> ResolutionResult.resolved(response.title(), confidence, raw, attempts);
            case REVIEW_REQUIRED -> ResolutionResult.reviewManual(confidence, raw, attempts);
            case PARSE_ERROR -> {
                log.debug("llm.response.malformed error={}", response.error());
                yield ResolutionResult.parseError(confidence, raw, attempts);
            }
        };
    }

    private double confidence(LLMCompletion completion, ModelResponse response) {
        OptionalDouble fromMetadata = completion.confidence();
        double value;
        if (fromMetadata.isPresent()) {
            value = fromMetadata.getAsDouble();
        } else if (response.statedConfidence().isPresent()) {
            value = response.statedConfidence().getAsDouble();
        } else {
            value = defaultConfidence;
        }
        if (Double.isNaN(value)) {
            return defaultConfidence;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private ResolutionCacheKey cacheKey(PersonRecord person, ResolutionMode mode) {
        String companyKey = person.hasAugmentedCompany()
                ? normalizer.normalize(person.companyNew(), person.domainNew()).toString()
                : normalizer.normalize(person.companyInput(), person.domainInput()).toString();
        return new ResolutionCacheKey(mode, titleKey(person.titleInput()), titleKey(person.titleNew()), companyKey);
    }

    private static String titleKey(String title) {
        return title == null ? "" : title.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public boolean isAvailable() {
        return provider.isAvailable();
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    @Override
    public void close() {
        callExecutor.shutdown();
        try {
            if (!callExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                callExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "title-resolver-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private LLMProvider provider;
        private ModelResponseParser parser = new ModelResponseParser();
        private TitlePromptBuilder promptBuilder = new TitlePromptBuilder();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration timeout = DEFAULT_TIMEOUT;
        private double defaultConfidence = DEFAULT_CONFIDENCE;
        private ResolutionCache cache = new NoOpResolutionCache();
        private MetricsService metrics = new NoOpMetricsService();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private CompanyNormalizer normalizer = new CompanyNormalizer();
        private int maxConcurrentCalls = DEFAULT_MAX_CONCURRENT_CALLS;

        public Builder provider(LLMProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder parser(ModelResponseParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder promptBuilder(TitlePromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder defaultConfidence(double defaultConfidence) {
            if (defaultConfidence < 0.0 || defaultConfidence > 1.0) {
                throw new IllegalArgumentException("defaultConfidence must be between 0.0 and 1.0");
            }
            this.defaultConfidence = defaultConfidence;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder normalizer(CompanyNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Upper bound on provider calls in flight. Match it to the worker pool size.
         */
        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            if (maxConcurrentCalls <= 0) {
                throw new IllegalArgumentException("maxConcurrentCalls must be > 0");
            }
            this.maxConcurrentCalls = maxConcurrentCalls;
            return this;
        }

        public TitleResolver build() {
            if (provider == null) {
                throw new IllegalStateException("LLMProvider is required");
            }
            Objects.requireNonNull(parser, "parser is required");
            Objects.requireNonNull(promptBuilder, "promptBuilder is required");
            Objects.requireNonNull(retryPolicy, "retryPolicy is required");
            Objects.requireNonNull(cache, "cache is required");
            Objects.requireNonNull(metrics, "metrics is required");
            Objects.requireNonNull(sleeper, "sleeper is required");
            Objects.requireNonNull(normalizer, "normalizer is required");
            return new TitleResolver(this);
        }
    }
}
