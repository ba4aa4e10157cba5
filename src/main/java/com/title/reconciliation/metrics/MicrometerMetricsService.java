package com.title.reconciliation.metrics;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.MdmDecision;
import com.title.reconciliation.core.model.ResolutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.llm.call.duration} (Timer, tag: outcome)</li>
 *   <li>{@code reconciliation.llm.retries} (Counter)</li>
 *   <li>{@code reconciliation.records.flagged} (Counter, tag: flag)</li>
 *   <li>{@code reconciliation.records.failed} (Counter)</li>
 *   <li>{@code reconciliation.company.decisions} (Counter, tag: decision)</li>
 *   <li>{@code reconciliation.job.duration} (Timer)</li>
 *   <li>{@code reconciliation.cache.hit} and {@code reconciliation.cache.miss} (Counter)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter retryCounter;
    private final Counter failedCounter;
    private final Timer jobTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.retryCounter = Counter.builder("reconciliation.llm.retries")
                .description("Number of model calls retried after a transient failure")
                .register(registry);
        this.failedCounter = Counter.builder("reconciliation.records.failed")
                .description("Number of records whose resolution failed")
                .register(registry);
        this.jobTimer = Timer.builder("reconciliation.job.duration")
                .description("Wall-clock duration of reconciliation jobs")
                .register(registry);
        this.cacheHitCounter = Counter.builder("reconciliation.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("reconciliation.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolution(ResolutionOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome.name(), k ->
                Timer.builder("reconciliation.llm.call.duration")
                        .description("Duration of title resolutions including retries")
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRetries() {
        retryCounter.increment();
    }

    @Override
    public void incrementFlag(ActionFlag flag) {
        counterCache.computeIfAbsent("flag:" + flag.name(), k ->
                Counter.builder("reconciliation.records.flagged")
                        .description("Number of records per action flag")
                        .tag("flag", flag.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementFailedRecords() {
        failedCounter.increment();
    }

    @Override
    public void incrementCompanyDecision(MdmDecision decision) {
        counterCache.computeIfAbsent("decision:" + decision.name(), k ->
                Counter.builder("reconciliation.company.decisions")
                        .description("Number of company master data decisions")
                        .tag("decision", decision.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordJobDuration(Duration duration) {
        jobTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
