package com.title.reconciliation.job;

import com.title.reconciliation.core.model.ActionableRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every callback in memory. Useful for callers polling a job and for tests.
 */
public class InMemoryJobStatusSink implements JobStatusSink {

    private final List<JobRunSnapshot> statusChanges = new CopyOnWriteArrayList<>();
    private final List<JobRunSnapshot> progress = new CopyOnWriteArrayList<>();
    private final List<ActionableRecord> completedRecords = new CopyOnWriteArrayList<>();
    private final List<JobReport> reports = new CopyOnWriteArrayList<>();

    @Override
    public void onStatusChange(JobRunSnapshot run, JobStatus previous) {
        statusChanges.add(run);
    }

    @Override
    public void onProgress(JobRunSnapshot run) {
        progress.add(run);
    }

    @Override
    public void onRecordCompleted(String jobId, ActionableRecord record) {
        completedRecords.add(record);
    }

    @Override
    public void onJobFinished(JobReport report) {
        reports.add(report);
    }

    /**
     * Statuses in the order they were reported.
     */
    public List<JobStatus> getStatusHistory() {
        List<JobStatus> history = new ArrayList<>();
        statusChanges.forEach(snapshot -> history.add(snapshot.status()));
        return history;
    }

    public List<JobRunSnapshot> getStatusChanges() {
        return List.copyOf(statusChanges);
    }

    public List<JobRunSnapshot> getProgress() {
        return List.copyOf(progress);
    }

    public List<ActionableRecord> getCompletedRecords() {
        return List.copyOf(completedRecords);
    }

    public List<JobReport> getReports() {
        return List.copyOf(reports);
    }

    public Optional<JobReport> lastReport() {
        return reports.isEmpty() ? Optional.empty() : Optional.of(reports.get(reports.size() - 1));
    }
}
