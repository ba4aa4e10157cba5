package com.title.reconciliation.api;

import com.title.reconciliation.audit.AuditService;
import com.title.reconciliation.bulk.PersonRecordSource;
import com.title.reconciliation.cache.ResolutionCache;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.job.AuditingJobStatusSink;
import com.title.reconciliation.job.JobOrchestrator;
import com.title.reconciliation.job.JobReport;
import com.title.reconciliation.job.JobRun;
import com.title.reconciliation.job.JobStatusSink;
import com.title.reconciliation.llm.LLMProvider;
import com.title.reconciliation.llm.ModelResponseParser;
import com.title.reconciliation.llm.Sleeper;
import com.title.reconciliation.llm.TitleResolver;
import com.title.reconciliation.mdm.CompanyMdmConsolidator;
import com.title.reconciliation.metrics.MetricsService;
import com.title.reconciliation.metrics.NoOpMetricsService;
import com.title.reconciliation.review.InMemoryReviewQueue;
import com.title.reconciliation.review.ReviewQueue;
import com.title.reconciliation.review.ReviewQueueSink;
import com.title.reconciliation.review.ReviewService;
import com.title.reconciliation.rules.CompanyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point of the reconciliation engine.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ReconciliationEngine engine = ReconciliationEngine.builder()
 *         .llmProvider(provider)
 *         .options(ReconciliationOptions.fromProperties(properties))
 *         .build()) {
 *     JobReport report = engine.run(records);
 *     report.records().forEach(r -&gt; System.out.println(r.personId() + " " + r.actionFlag()));
 * }
 * </pre>
 *
 * <p>Every job's status changes, record outcomes and company decisions are written to the
 * {@link AuditService}; records needing a human go to the {@link ReviewQueue}.</p>
 */
public class ReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final ResolutionCache cache;
    private final TitleResolver resolver;
    private final JobOrchestrator orchestrator;
    private final AuditService auditService;
    private final ReviewService reviewService;
    private final MetricsService metricsService;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, auditService);
        this.cache = builder.cache != null ? builder.cache : ResolutionCache.create(options.getCacheConfig());

        CompanyNormalizer normalizer = new CompanyNormalizer();
        this.resolver = TitleResolver.builder()
                .provider(builder.llmProvider)
                .parser(new ModelResponseParser(options.getMaxTitleLength()))
                .retryPolicy(options.getRetryPolicy())
                .timeout(options.getLlmTimeout())
                .defaultConfidence(options.getDefaultConfidence())
                .cache(cache)
                .metrics(metricsService)
                .sleeper(builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM)
                .normalizer(normalizer)
                .maxConcurrentCalls(options.getMaxConcurrency())
                .build();

        List<JobStatusSink> sinks = new ArrayList<>();
        sinks.add(new AuditingJobStatusSink(auditService));
        sinks.add(new ReviewQueueSink(reviewService));
        if (builder.statusSink != null) {
            sinks.add(builder.statusSink);
        }

        this.orchestrator = JobOrchestrator.builder()
                .resolver(resolver)
                .consolidator(new CompanyMdmConsolidator(normalizer, metricsService))
                .sink(JobStatusSink.composite(sinks))
                .metrics(metricsService)
                .maxConcurrency(options.getMaxConcurrency())
                .progressInterval(options.getProgressInterval())
                .build();

        log.info("ReconciliationEngine initialized provider={} options={}", resolver.getProviderName(), options);
    }

    /**
     * Creates a pending job sized for the given records. Keep the returned run to
     * observe progress or request cancellation.
     */
    public JobRun createJob(List<PersonRecord> records) {
        return JobRun.create(records != null ? records.size() : 0);
    }

    /**
     * Reconciles a batch in a new job and blocks until it finishes.
     */
    public JobReport run(List<PersonRecord> records) {
        return run(createJob(records), records);
    }

    /**
     * Reconciles a batch in the given pending job and blocks until it finishes.
     */
    public JobReport run(JobRun job, List<PersonRecord> records) {
        return orchestrator.execute(job, records);
    }

    /**
     * Reads the batch from the source, then reconciles it.
     *
     * @throws IOException when the source cannot be read
     */
    public JobReport run(PersonRecordSource source) throws IOException {
        return run(source.read());
    }

    public CompletableFuture<JobReport> runAsync(JobRun job, List<PersonRecord> records) {
        return orchestrator.executeAsync(job, records);
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    @Override
    public void close() {
        orchestrator.close();
        resolver.close();
        log.info("ReconciliationEngine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LLMProvider llmProvider;
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService;
        private AuditService auditService;
        private ReviewQueue reviewQueue;
        private JobStatusSink statusSink;
        private ResolutionCache cache;
        private Sleeper sleeper;

        /**
         * Sets the model provider used to resolve titles. Required.
         */
        public Builder llmProvider(LLMProvider llmProvider) {
            this.llmProvider = llmProvider;
            return this;
        }

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Defaults to {@link InMemoryReviewQueue} if not set.
         */
        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        /**
         * Additional sink notified after the audit trail and review queue.
         */
        public Builder statusSink(JobStatusSink statusSink) {
            this.statusSink = statusSink;
            return this;
        }

        /**
         * Overrides the cache built from {@link ReconciliationOptions#getCacheConfig()}.
         */
        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Overrides how retry backoff waits.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public ReconciliationEngine build() {
            if (llmProvider == null) {
                throw new IllegalStateException("LLMProvider is required");
            }
            if (options == null) {
                throw new IllegalStateException("ReconciliationOptions are required");
            }
            return new ReconciliationEngine(this);
        }
    }
}
