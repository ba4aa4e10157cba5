package com.title.reconciliation.job;

import com.title.reconciliation.action.ActionFlagAssigner;
import com.title.reconciliation.action.FlagAssignment;
import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionResult;
import com.title.reconciliation.core.model.ReviewReason;
import com.title.reconciliation.core.model.TriggerScenario;
import com.title.reconciliation.llm.TitleResolver;
import com.title.reconciliation.logging.LogContext;
import com.title.reconciliation.mdm.CompanyMdmConsolidator;
import com.title.reconciliation.metrics.MetricsService;
import com.title.reconciliation.metrics.NoOpMetricsService;
import com.title.reconciliation.trigger.TriggerClassification;
import com.title.reconciliation.trigger.TriggerClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs one batch of person records through classification, resolution and flag assignment on a
 * bounded worker pool, then consolidates company decisions once every record has finished.
 *
 * <p>A single record never aborts the batch: unexpected errors are turned into a REVIEW_TITLE
 * result and counted as failed. A record repeating an earlier person id is handled the same way,
 * without a model call, and is left out of company consolidation. Setup problems fail the job
 * before anything is dispatched.</p>
 *
 * <p>Cancellation skips records that have not started and stops retries of records in flight.</p>
 */
public class JobOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    public static final int DEFAULT_MAX_CONCURRENCY = 5;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;
    static final String CANCELLED_MESSAGE = "cancelled";

    private final TriggerClassifier classifier;
    private final TitleResolver resolver;
    private final ActionFlagAssigner assigner;
    private final CompanyMdmConsolidator consolidator;
    private final JobStatusSink sink;
    private final MetricsService metrics;
    private final int maxConcurrency;
    private final int progressInterval;
    private final ExecutorService asyncExecutor;

    private JobOrchestrator(Builder builder) {
        this.classifier = builder.classifier;
        this.resolver = builder.resolver;
        this.assigner = builder.assigner;
        this.consolidator = builder.consolidator;
        this.sink = builder.sink;
        this.metrics = builder.metrics;
        this.maxConcurrency = builder.maxConcurrency;
        this.progressInterval = builder.progressInterval;
        this.asyncExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("reconciliation-job-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the job to completion on a background thread.
     */
    public CompletableFuture<JobReport> executeAsync(JobRun run, List<PersonRecord> records) {
        return CompletableFuture.supplyAsync(() -> execute(run, records), asyncExecutor);
    }

    /**
     * Runs the job and blocks until every dispatched record has finished.
     *
     * @param run     a pending job whose total matches the number of records
     * @param records the batch, in input order
     * @return the report; when setup fails the job is FAILED and the report has no records
     * @throws IllegalStateException when the job is not pending
     */
    public JobReport execute(JobRun run, List<PersonRecord> records) {
        Objects.requireNonNull(run, "run is required");
        if (run.getStatus() != JobStatus.PENDING) {
            throw new IllegalStateException("Job " + run.getJobId() + " is " + run.getStatus() + ", expected PENDING");
        }

        try (LogContext ctx = LogContext.forJob(run.getJobId())) {
            try {
                validate(run, records);
            } catch (SetupException e) {
                log.error("job.setup.failed jobId={} error={}", run.getJobId(), e.getMessage());
                if (run.fail(e.getMessage())) {
                    notify(s -> s.onStatusChange(run.snapshot(), JobStatus.PENDING));
                }
                JobReport report = new JobReport(run.snapshot(), List.of(), List.of(),
                        JobStatistics.empty(run.getTotal()));
                notify(s -> s.onJobFinished(report));
                return report;
            }

            if (!run.start()) {
                throw new IllegalStateException("Job " + run.getJobId() + " could not be started");
            }
            notify(s -> s.onStatusChange(run.snapshot(), JobStatus.PENDING));
            log.info("job.started jobId={} total={} maxConcurrency={}", run.getJobId(), run.getTotal(), maxConcurrency);

            boolean[] duplicates = duplicatePersonIds(run, records);
            ActionableRecord[] results = new ActionableRecord[records.size()];
            AtomicInteger llmCalls = new AtomicInteger();
            LongAdder recordNanos = new LongAdder();
            dispatchAndAwait(run, records, duplicates, results, llmCalls, recordNanos);

            List<ActionableRecord> completed = new ArrayList<>(records.size());
            List<ActionableRecord> distinct = new ArrayList<>(records.size());
            for (int i = 0; i < results.length; i++) {
                if (results[i] != null) {
                    completed.add(results[i]);
                    if (!duplicates[i]) {
                        distinct.add(results[i]);
                    }
                }
            }

            List<CompanyMdmDecision> decisions = finish(run, distinct);

            metrics.recordJobDuration(run.processingTime());
            JobRunSnapshot finalState = run.snapshot();
            JobReport report = new JobReport(finalState, completed, decisions,
                    JobStatistics.compute(completed, finalState, llmCalls.get(), recordNanos.sum()));
            notify(s -> s.onJobFinished(report));

            log.info("job.finished jobId={} status={} processed={} failed={} skipped={} companies={} durationMs={}",
                    run.getJobId(), finalState.status(), finalState.processed(), finalState.failed(),
                    finalState.skipped(), decisions.size(), finalState.processingTimeMs());
            return report;
        }
    }

    /**
     * Marks every record whose person id already appeared earlier in the batch.
     */
    private static boolean[] duplicatePersonIds(JobRun run, List<PersonRecord> records) {
        boolean[] duplicates = new boolean[records.size()];
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            if (!seen.add(records.get(i).personId())) {
                duplicates[i] = true;
                log.warn("record.duplicate jobId={} personId={} index={}",
                        run.getJobId(), records.get(i).personId(), i);
            }
        }
        return duplicates;
    }

    private void dispatchAndAwait(JobRun run, List<PersonRecord> records, boolean[] duplicates,
                                  ActionableRecord[] results, AtomicInteger llmCalls, LongAdder recordNanos) {
        if (records.isEmpty()) {
            return;
        }
        int poolSize = Math.min(maxConcurrency, records.size());
        ExecutorService workers = Executors.newFixedThreadPool(poolSize,
                new NamedThreadFactory("reconciliation-worker-"));
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                int index = i;
                futures.add(CompletableFuture.runAsync(
                        () -> results[index] = processSlot(run, records.get(index), duplicates[index],
                                llmCalls, recordNanos),
                        workers));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("job.worker.crashed jobId={} error={}", run.getJobId(), e.getCause() != null
                    ? e.getCause().toString() : e.toString());
        } finally {
            workers.shutdown();
            awaitTermination(workers);
        }
    }

    /**
     * Processes one record, or skips it when cancellation was requested before it started.
     *
     * @return the result, null when skipped
     */
    private ActionableRecord processSlot(JobRun run, PersonRecord person, boolean duplicate,
                                         AtomicInteger llmCalls, LongAdder recordNanos) {
        if (run.isCancelRequested()) {
            run.incrementSkipped();
            log.debug("record.skipped jobId={} personId={}", run.getJobId(), person.personId());
            return null;
        }

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRecord(run.getJobId(), person.personId())) {
            ActionableRecord result = duplicate
                    ? duplicateRecord(person)
                    : processRecord(person, llmCalls, run::isCancelRequested);
            if (result.failed()) {
                run.incrementFailed();
                metrics.incrementFailedRecords();
            }
            metrics.incrementFlag(result.actionFlag());
            int processed = run.incrementProcessed();
            recordNanos.add(System.nanoTime() - start);
            log.debug("record.completed scenario={} flag={} reason={}",
                    result.scenario(), result.actionFlag(), result.reviewReason());

            notify(s -> s.onRecordCompleted(run.getJobId(), result));
            if (progressInterval > 0 && processed % progressInterval == 0 && processed < run.getTotal()) {
                notify(s -> s.onProgress(run.snapshot()));
            }
            return result;
        }
    }

    ActionableRecord processRecord(PersonRecord person, AtomicInteger llmCalls, BooleanSupplier cancelled) {
        TriggerScenario scenario = TriggerScenario.NO_TRIGGER;
        try {
            TriggerClassification classification = classifier.classify(person);
            scenario = classification.scenario();

            ResolutionResult resolution = null;
            if (classification.requiresResolution()) {
                resolution = resolver.resolve(person, classification.mode().orElseThrow(), cancelled);
                llmCalls.addAndGet(resolution.attempts());
            }

            FlagAssignment assignment = assigner.assign(person, classification, resolution);
            String resolvedTitle = resolution != null ? resolution.resolvedTitle() : person.titleInput();
            boolean failed = resolution != null && resolution.isFailure();
            return new ActionableRecord(person, scenario, resolvedTitle, assignment.actionFlag(),
                    assignment.reviewReason(), resolution, failed);
        } catch (RuntimeException e) {
            log.error("record.error personId={} error={}", person.personId(), e.toString());
            return new ActionableRecord(person, scenario, null, ActionFlag.REVIEW_TITLE,
                    ReviewReason.RECORD_ERROR, null, true);
        }
    }

    private ActionableRecord duplicateRecord(PersonRecord person) {
        TriggerScenario scenario = classifier.classify(person).scenario();
        log.error("record.error personId={} error=duplicate person id", person.personId());
        return new ActionableRecord(person, scenario, null, ActionFlag.REVIEW_TITLE,
                ReviewReason.RECORD_ERROR, null, true);
    }

    private List<CompanyMdmDecision> finish(JobRun run, List<ActionableRecord> completed) {
        if (run.getSkipped() > 0 || run.getProcessed() < run.getTotal()) {
            String message = run.isCancelRequested() ? CANCELLED_MESSAGE
                    : "only " + run.getProcessed() + " of " + run.getTotal() + " records processed";
            if (run.fail(message)) {
                notify(s -> s.onStatusChange(run.snapshot(), JobStatus.RUNNING));
            }
            log.warn("job.failed jobId={} reason={} processed={} skipped={}",
                    run.getJobId(), message, run.getProcessed(), run.getSkipped());
            return List.of();
        }

        List<CompanyMdmDecision> decisions;
        try {
            decisions = consolidator.consolidate(completed);
        } catch (RuntimeException e) {
            log.error("job.consolidation.failed jobId={} error={}", run.getJobId(), e.toString());
            if (run.fail("consolidation failed: " + e.getMessage())) {
                notify(s -> s.onStatusChange(run.snapshot(), JobStatus.RUNNING));
            }
            return List.of();
        }

        notify(s -> s.onProgress(run.snapshot()));
        if (run.complete()) {
            notify(s -> s.onStatusChange(run.snapshot(), JobStatus.RUNNING));
        }
        return decisions;
    }

    /**
     * Rejects the job before dispatch.
     */
    void validate(JobRun run, List<PersonRecord> records) {
        if (records == null) {
            throw new SetupException("records must not be null");
        }
        if (records.size() != run.getTotal()) {
            throw new SetupException("Job " + run.getJobId() + " expects " + run.getTotal()
                    + " records but " + records.size() + " were supplied");
        }
        boolean anyTriggered = false;
        for (PersonRecord record : records) {
            if (record == null) {
                throw new SetupException("records must not contain null entries");
            }
            anyTriggered |= classifier.classify(record).requiresResolution();
        }
        if (anyTriggered && !resolver.isAvailable()) {
            throw new SetupException("LLM provider " + resolver.getProviderName() + " is not available");
        }
    }

    private void notify(Consumer<JobStatusSink> callback) {
        try {
            callback.accept(sink);
        } catch (RuntimeException e) {
            log.warn("job.sink.failed error={}", e.toString());
        }
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    @Override
    public void close() {
        asyncExecutor.shutdown();
        awaitTermination(asyncExecutor);
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private TriggerClassifier classifier = new TriggerClassifier();
        private TitleResolver resolver;
        private ActionFlagAssigner assigner = new ActionFlagAssigner();
        private CompanyMdmConsolidator consolidator = new CompanyMdmConsolidator();
        private JobStatusSink sink = JobStatusSink.NOOP;
        private MetricsService metrics = new NoOpMetricsService();
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder classifier(TriggerClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder resolver(TitleResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder assigner(ActionFlagAssigner assigner) {
            this.assigner = assigner;
            return this;
        }

        public Builder consolidator(CompanyMdmConsolidator consolidator) {
            this.consolidator = consolidator;
            return this;
        }

        public Builder sink(JobStatusSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be > 0");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public JobOrchestrator build() {
            if (resolver == null) {
                throw new IllegalStateException("TitleResolver is required");
            }
            Objects.requireNonNull(classifier, "classifier is required");
            Objects.requireNonNull(assigner, "assigner is required");
            Objects.requireNonNull(consolidator, "consolidator is required");
            Objects.requireNonNull(sink, "sink is required");
            Objects.requireNonNull(metrics, "metrics is required");
            return new JobOrchestrator(this);
        }
    }
}
