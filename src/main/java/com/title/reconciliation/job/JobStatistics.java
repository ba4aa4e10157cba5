package com.title.reconciliation.job;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.TriggerScenario;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary figures for a finished job.
 *
 * @param successRate             processed share of the total in percent, 2 decimals
 * @param averageProcessingTimeMs mean wall time per processed record, 2 decimals
 */
public record JobStatistics(
        int total,
        int processed,
        int failed,
        int skipped,
        Map<ActionFlag, Integer> flagCounts,
        Map<TriggerScenario, Integer> scenarioCounts,
        int llmCalls,
        double successRate,
        double averageProcessingTimeMs
) {
    public JobStatistics {
        flagCounts = Collections.unmodifiableMap(fill(ActionFlag.class, flagCounts));
        scenarioCounts = Collections.unmodifiableMap(fill(TriggerScenario.class, scenarioCounts));
    }

    public static JobStatistics empty(int total) {
        return new JobStatistics(total, 0, 0, 0, Map.of(), Map.of(), 0, 0.0, 0.0);
    }

    /**
     * @param records          the processed records
     * @param run              counters at the end of the job
     * @param llmCalls         provider calls issued across all records
     * @param recordTimeNanos  summed per-record processing time
     */
    public static JobStatistics compute(List<ActionableRecord> records, JobRunSnapshot run,
                                        int llmCalls, long recordTimeNanos) {
        Map<ActionFlag, Integer> flags = new EnumMap<>(ActionFlag.class);
        Map<TriggerScenario, Integer> scenarios = new EnumMap<>(TriggerScenario.class);
        for (ActionableRecord record : records) {
            flags.merge(record.actionFlag(), 1, Integer::sum);
            scenarios.merge(record.scenario(), 1, Integer::sum);
        }
        double successRate = run.total() > 0 ? round2(run.processed() * 100.0 / run.total()) : 0.0;
        double averageMs = run.processed() > 0 ? round2(recordTimeNanos / 1_000_000.0 / run.processed()) : 0.0;
        return new JobStatistics(run.total(), run.processed(), run.failed(), run.skipped(),
                flags, scenarios, llmCalls, successRate, averageMs);
    }

    public int count(ActionFlag flag) {
        return flagCounts.get(flag);
    }

    public int count(TriggerScenario scenario) {
        return scenarioCounts.get(scenario);
    }

    private static <E extends Enum<E>> Map<E, Integer> fill(Class<E> type, Map<E, Integer> counts) {
        Map<E, Integer> filled = new EnumMap<>(type);
        for (E key : type.getEnumConstants()) {
            filled.put(key, counts != null ? counts.getOrDefault(key, 0) : 0);
        }
        return filled;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
