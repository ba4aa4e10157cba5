package com.title.reconciliation.job;

import com.title.reconciliation.core.model.ActionableRecord;

import java.util.List;

/**
 * Receives job progress. Called from worker threads; implementations must be thread-safe.
 */
public interface JobStatusSink {

    /**
     * The job moved from {@code previous} to {@code run.status()}.
     */
    default void onStatusChange(JobRunSnapshot run, JobStatus previous) {
    }

    default void onProgress(JobRunSnapshot run) {
    }

    default void onRecordCompleted(String jobId, ActionableRecord record) {
    }

    default void onJobFinished(JobReport report) {
    }

    /**
     * A sink that ignores everything.
     */
    JobStatusSink NOOP = new JobStatusSink() {
    };

    /**
     * Fans every callback out to the given sinks, in order.
     */
    static JobStatusSink composite(List<JobStatusSink> sinks) {
        List<JobStatusSink> targets = List.copyOf(sinks);
        return new JobStatusSink() {
            @Override
            public void onStatusChange(JobRunSnapshot run, JobStatus previous) {
                targets.forEach(sink -> sink.onStatusChange(run, previous));
            }

            @Override
            public void onProgress(JobRunSnapshot run) {
                targets.forEach(sink -> sink.onProgress(run));
            }

            @Override
            public void onRecordCompleted(String jobId, ActionableRecord record) {
                targets.forEach(sink -> sink.onRecordCompleted(jobId, record));
            }

            @Override
            public void onJobFinished(JobReport report) {
                targets.forEach(sink -> sink.onJobFinished(report));
            }
        };
    }
}
