package com.title.reconciliation.metrics;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.MdmDecision;
import com.title.reconciliation.core.model.ResolutionOutcome;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordResolution(ResolutionOutcome outcome, Duration duration);

    void incrementRetries();

    void incrementFlag(ActionFlag flag);

    void incrementFailedRecords();

    void incrementCompanyDecision(MdmDecision decision);

    void recordJobDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
