package com.title.reconciliation.metrics;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.MdmDecision;
import com.title.reconciliation.core.model.ResolutionOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(ResolutionOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementRetries() {
    }

    @Override
    public void incrementFlag(ActionFlag flag) {
    }

    @Override
    public void incrementFailedRecords() {
    }

    @Override
    public void incrementCompanyDecision(MdmDecision decision) {
    }

    @Override
    public void recordJobDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
