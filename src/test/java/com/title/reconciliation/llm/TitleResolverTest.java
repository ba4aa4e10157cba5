package com.title.reconciliation.llm;

import com.title.reconciliation.cache.CacheConfig;
import com.title.reconciliation.cache.CaffeineResolutionCache;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionMode;
import com.title.reconciliation.core.model.ResolutionOutcome;
import com.title.reconciliation.core.model.ResolutionResult;
import com.title.reconciliation.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TitleResolverTest {

    @Mock
    private LLMProvider provider;

    private final List<Duration> sleeps = new ArrayList<>();
    private SimpleMeterRegistry registry;
    private TitleResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        resolver = resolverBuilder().build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private TitleResolver.Builder resolverBuilder() {
        return TitleResolver.builder()
                .provider(provider)
                .metrics(new MicrometerMetricsService(registry))
                .sleeper(sleeps::add);
    }

    private static PersonRecord newTitle(String personId) {
        return PersonRecord.builder()
                .personId(personId)
                .titleNew("VP of Sales")
                .companyNew("Acme Inc.")
                .build();
    }

    private static TransientProviderException timeout() {
        return new TransientProviderException(TransientProviderException.Reason.TIMEOUT, "timed out");
    }

    @Nested
    @DisplayName("Successful calls")
    class Success {

        @Test
        @DisplayName("Clean title resolves with provider confidence")
        void testResolvedWithMetadataConfidence() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("Vice President of Sales", 0.92));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.RESOLVED, result.outcome());
            assertEquals("Vice President of Sales", result.resolvedTitle());
            assertEquals(0.92, result.confidence(), 0.0001);
            assertFalse(result.reviewRequired());
            assertEquals(1, result.attempts());
        }

        @Test
        @DisplayName("Stated confidence is used when metadata has none")
        void testStatedConfidence() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("{\"title\": \"Sr. Manager\", \"confidence\": 0.9}"));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(0.9, result.confidence(), 0.0001);
        }

        @Test
        @DisplayName("Default confidence applies otherwise and out-of-range values are clamped")
        void testDefaultAndClampedConfidence() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("CTO"))
                    .thenReturn(new LLMCompletion("CTO", Map.of(LLMCompletion.CONFIDENCE_KEY, 7.5)));

            assertEquals(TitleResolver.DEFAULT_CONFIDENCE,
                    resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE).confidence(), 0.0001);
            assertEquals(1.0,
                    resolver.resolve(newTitle("p2"), ResolutionMode.EXTRAPOLATE).confidence(), 0.0001);
        }

        @Test
        @DisplayName("Review sentinel flags review without a title")
        void testReviewManual() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("REVIEW_MANUAL"));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.ARBITRATE);

            assertEquals(ResolutionOutcome.REVIEW_MANUAL, result.outcome());
            assertTrue(result.reviewRequired());
            assertNull(result.resolvedTitle());
            assertEquals("REVIEW_MANUAL", result.rawModelOutput());
        }

        @Test
        @DisplayName("Malformed answer is a parse error result")
        void testParseError() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("Line one\nLine two"));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.PARSE_ERROR, result.outcome());
            assertTrue(result.reviewRequired());
            assertFalse(result.isFailure());
        }

        @Test
        @DisplayName("Prompt names the resolution mode")
        void testPromptCarriesMode() {
            when(provider.complete(contains("Mode: arbitrate"), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("Sr. Manager"));

            PersonRecord person = PersonRecord.builder()
                    .personId("p1").titleInput("Manager").titleNew("Sr. Manager").build();

            assertEquals("Sr. Manager", resolver.resolve(person, ResolutionMode.ARBITRATE).resolvedTitle());
            verify(provider).complete(anyString(), eq(TitleResolver.DEFAULT_TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("Transient failure is retried after backoff")
        void testRetryThenSuccess() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenThrow(timeout())
                    .thenReturn(LLMCompletion.of("VP of Sales"));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.RESOLVED, result.outcome());
            assertEquals(2, result.attempts());
            assertEquals(List.of(Duration.ofSeconds(4)), sleeps);
            assertEquals(1.0, registry.counter("reconciliation.llm.retries").count());
        }

        @Test
        @DisplayName("Every attempt timing out exhausts retries")
        void testRetriesExhausted() {
            when(provider.complete(anyString(), any(Duration.class))).thenThrow(timeout());

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
            assertEquals(3, result.attempts());
            assertTrue(result.reviewRequired());
            assertEquals(List.of(Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
            verify(provider, times(3)).complete(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Slow provider calls are cut off by the timeout")
        void testCallTimeout() {
            resolver.close();
            resolver = resolverBuilder()
                    .timeout(Duration.ofMillis(50))
                    .retryPolicy(new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 1.0))
                    .build();
            when(provider.complete(anyString(), any(Duration.class))).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return LLMCompletion.of("too late");
            });

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
            assertEquals(2, result.attempts());
        }

        @Test
        @DisplayName("Non-transient error is not retried")
        void testProviderError() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenThrow(new IllegalStateException("bad credentials"));

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertEquals(ResolutionOutcome.PROVIDER_ERROR, result.outcome());
            assertEquals(1, result.attempts());
            assertEquals("bad credentials", result.rawModelOutput());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("Cancellation stops retries before the next call")
        void testCancelledBeforeRetry() {
            AtomicBoolean cancelled = new AtomicBoolean();
            when(provider.complete(anyString(), any(Duration.class))).thenAnswer(invocation -> {
                cancelled.set(true);
                throw timeout();
            });

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE, cancelled::get);

            assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
            assertEquals(1, result.attempts());
            assertTrue(sleeps.isEmpty());
            verify(provider, times(1)).complete(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Cancellation during backoff skips the retry")
        void testCancelledDuringBackoff() {
            AtomicBoolean cancelled = new AtomicBoolean();
            resolver.close();
            resolver = resolverBuilder()
                    .sleeper(duration -> cancelled.set(true))
                    .build();
            when(provider.complete(anyString(), any(Duration.class))).thenThrow(timeout());

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE, cancelled::get);

            assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
            assertEquals(1, result.attempts());
            verify(provider, times(1)).complete(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Calls stuck past their timeout keep their slot")
        void testBoundedCallSlots() {
            resolver.close();
            resolver = resolverBuilder()
                    .timeout(Duration.ofMillis(50))
                    .retryPolicy(new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 1.0))
                    .maxConcurrentCalls(1)
                    .build();
            CountDownLatch release = new CountDownLatch(1);
            when(provider.complete(anyString(), any(Duration.class))).thenAnswer(invocation -> {
                awaitIgnoringInterrupts(release);
                return LLMCompletion.of("too late");
            });

            try {
                ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

                assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
                assertEquals(2, result.attempts());
                assertEquals(1, resolver.getMaxConcurrentCalls());
                verify(provider, times(1)).complete(anyString(), any(Duration.class));
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("Interrupted backoff gives up")
        void testInterruptedBackoff() {
            resolver.close();
            resolver = TitleResolver.builder()
                    .provider(provider)
                    .sleeper(duration -> {
                        throw new InterruptedException("shutdown");
                    })
                    .build();
            when(provider.complete(anyString(), any(Duration.class))).thenThrow(timeout());

            ResolutionResult result = resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);

            assertTrue(Thread.interrupted());
            assertEquals(ResolutionOutcome.RETRIES_EXHAUSTED, result.outcome());
            assertEquals(1, result.attempts());
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @BeforeEach
        void withCache() {
            resolver.close();
            resolver = resolverBuilder()
                    .cache(new CaffeineResolutionCache(CacheConfig.defaults()))
                    .build();
        }

        @Test
        @DisplayName("Equivalent requests share one answer")
        void testCacheHit() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("Vice President of Sales"));

            PersonRecord first = newTitle("p1");
            PersonRecord second = PersonRecord.builder()
                    .personId("p2")
                    .titleNew("vp  of SALES")
                    .companyNew("ACME, Inc")
                    .build();

            ResolutionResult fresh = resolver.resolve(first, ResolutionMode.EXTRAPOLATE);
            ResolutionResult cached = resolver.resolve(second, ResolutionMode.EXTRAPOLATE);

            assertEquals(1, fresh.attempts());
            assertEquals(0, cached.attempts());
            assertEquals("Vice President of Sales", cached.resolvedTitle());
            verify(provider, times(1)).complete(anyString(), any(Duration.class));
            assertEquals(1.0, registry.counter("reconciliation.cache.hit").count());
            assertEquals(1.0, registry.counter("reconciliation.cache.miss").count());
        }

        @Test
        @DisplayName("Failed resolutions are not cached")
        void testFailuresNotCached() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("REVIEW_MANUAL"));

            resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);
            resolver.resolve(newTitle("p2"), ResolutionMode.EXTRAPOLATE);

            verify(provider, times(2)).complete(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Different modes do not share answers")
        void testModeIsPartOfKey() {
            when(provider.complete(anyString(), any(Duration.class)))
                    .thenReturn(LLMCompletion.of("VP of Sales"));

            resolver.resolve(newTitle("p1"), ResolutionMode.EXTRAPOLATE);
            resolver.resolve(newTitle("p2"), ResolutionMode.ARBITRATE);

            verify(provider, times(2)).complete(anyString(), any(Duration.class));
        }
    }

    @Test
    @DisplayName("Builder requires a provider")
    void testBuilderRequiresProvider() {
        assertThrows(IllegalStateException.class, () -> TitleResolver.builder().build());
    }

    @Test
    @DisplayName("Call slots default to the worker pool size and must be positive")
    void testMaxConcurrentCalls() {
        assertEquals(TitleResolver.DEFAULT_MAX_CONCURRENT_CALLS, resolver.getMaxConcurrentCalls());
        assertThrows(IllegalArgumentException.class, () -> TitleResolver.builder().maxConcurrentCalls(0));
    }

    @Test
    @DisplayName("Resolver reports provider availability")
    void testAvailability() {
        when(provider.isAvailable()).thenReturn(true);
        when(provider.getProviderName()).thenReturn("Mock");

        assertTrue(resolver.isAvailable());
        assertEquals("Mock", resolver.getProviderName());
        assertEquals(RetryPolicy.defaults(), resolver.getRetryPolicy());
    }
}
