package com.title.reconciliation.metrics;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.MdmDecision;
import com.title.reconciliation.core.model.ResolutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolution(ResolutionOutcome.RESOLVED, Duration.ofMillis(100));
                noOp.incrementRetries();
                noOp.incrementFlag(ActionFlag.UPDATE_TITLE);
                noOp.incrementFailedRecords();
                noOp.incrementCompanyDecision(MdmDecision.TRUE_JOB_CHANGE);
                noOp.recordJobDuration(Duration.ofSeconds(1));
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record model call duration per outcome")
        void recordResolution() {
            metrics.recordResolution(ResolutionOutcome.RESOLVED, Duration.ofMillis(150));
            metrics.recordResolution(ResolutionOutcome.RESOLVED, Duration.ofMillis(250));
            metrics.recordResolution(ResolutionOutcome.RETRIES_EXHAUSTED, Duration.ofMillis(900));

            Timer resolved = registry.find("reconciliation.llm.call.duration")
                    .tag("outcome", "RESOLVED")
                    .timer();

            assertNotNull(resolved);
            assertEquals(2, resolved.count());
            assertEquals(1, registry.find("reconciliation.llm.call.duration")
                    .tag("outcome", "RETRIES_EXHAUSTED").timer().count());
        }

        @Test
        @DisplayName("Should count flags per flag value")
        void incrementFlag() {
            metrics.incrementFlag(ActionFlag.REVIEW_TITLE);
            metrics.incrementFlag(ActionFlag.REVIEW_TITLE);
            metrics.incrementFlag(ActionFlag.KEEP_ORIGINAL);

            Counter review = registry.find("reconciliation.records.flagged").tag("flag", "REVIEW_TITLE").counter();
            Counter keep = registry.find("reconciliation.records.flagged").tag("flag", "KEEP_ORIGINAL").counter();

            assertNotNull(review);
            assertEquals(2.0, review.count());
            assertEquals(1.0, keep.count());
        }

        @Test
        @DisplayName("Should count company decisions")
        void incrementCompanyDecision() {
            metrics.incrementCompanyDecision(MdmDecision.COMPANY_DATA_UPDATE);

            assertEquals(1.0, registry.find("reconciliation.company.decisions")
                    .tag("decision", "COMPANY_DATA_UPDATE").counter().count());
        }

        @Test
        @DisplayName("Should count retries, failures and cache lookups")
        void simpleCounters() {
            metrics.incrementRetries();
            metrics.incrementRetries();
            metrics.incrementFailedRecords();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("reconciliation.llm.retries").counter().count());
            assertEquals(1.0, registry.find("reconciliation.records.failed").counter().count());
            assertEquals(1.0, registry.find("reconciliation.cache.hit").counter().count());
            assertEquals(2.0, registry.find("reconciliation.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should time jobs")
        void recordJobDuration() {
            metrics.recordJobDuration(Duration.ofSeconds(2));

            Timer timer = registry.find("reconciliation.job.duration").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }
    }
}
