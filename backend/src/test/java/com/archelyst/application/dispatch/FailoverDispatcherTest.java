/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.archelyst.application.cache.CacheEntry;
import com.archelyst.application.cache.CacheKeys;
import com.archelyst.application.cache.CacheTtlPolicy;
import com.archelyst.application.cache.ResponseCache;
import com.archelyst.application.health.ProviderHealthService;
import com.archelyst.application.ratelimit.ProviderRateLimiter;
import com.archelyst.application.ratelimit.RateLimitPolicy;
import com.archelyst.application.registry.ProviderDescriptor;
import com.archelyst.application.registry.ProviderRegistry;
import com.archelyst.application.registry.ProviderSettings;
import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.CircuitState;
import com.archelyst.domain.model.FailureKind;
import com.archelyst.infrastructure.provider.ProviderErrorType;
import com.archelyst.support.MutableClock;
import com.archelyst.support.StubAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailoverDispatcherTest {
    private static final String QUOTE = "quote";

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ProviderRegistry registry = new ProviderRegistry();

    private ProviderHealthService health;
    private ProviderRateLimiter rateLimiter;
    private ResponseCache cache;
    private CacheKeys cacheKeys;
    private DispatchStatistics statistics;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void secondIdenticalDispatchIsServedFromCache() {
        StubAdapter a = register("a", 1);
        FailoverDispatcher dispatcher = dispatcher(3, clock);

        DispatchResult first = dispatcher.dispatch(quote("AAPL"));
        DispatchResult second = dispatcher.dispatch(quote("AAPL"));

        assertFalse(first.cacheHit());
        assertTrue(second.cacheHit());
        assertEquals("a", second.provider());
        assertEquals(first.value(), second.value());
        assertEquals(1, a.invocations());
        assertEquals(1, statistics.snapshot().cacheHits());
    }

    @Test
    void openCircuitIsSkippedWithoutInvocationUntilBackoffElapses() {
        StubAdapter a = register("a", 1);
        StubAdapter b = register("b", 2);
        a.fail(ProviderErrorType.UNAVAILABLE);
        FailoverDispatcher dispatcher = dispatcher(3, clock);

        for (int i = 0; i < 3; i++) {
            assertEquals("b", dispatcher.dispatch(quote("S" + i)).provider());
        }
        assertEquals(3, a.invocations());

        DispatchResult skipped = dispatcher.dispatch(quote("S3"));
        assertEquals("b", skipped.provider());
        assertEquals(3, a.invocations());
        assertEquals(List.of(ProviderAttempt.skipped("a", FailureKind.CIRCUIT_OPEN, "Circuit open")), skipped.attempts());

        clock.advance(Duration.ofSeconds(1));
        a.succeed();
        DispatchResult trial = dispatcher.dispatch(quote("S4"));
        assertEquals("a", trial.provider());
        assertEquals(CircuitState.CLOSED, health.getSnapshot("a").circuitState());
        assertEquals(0, health.getSnapshot("a").consecutiveFailures());
        assertEquals(4, b.invocations());
    }

    @Test
    void onlyTheFirstHealthyAndUnthrottledCandidateIsInvoked() {
        StubAdapter a = register("a", 1);
        StubAdapter b = register("b", 2, new RateLimitPolicy(1, 0.0));
        StubAdapter c = register("c", 3);
        FailoverDispatcher dispatcher = dispatcher(1, clock);

        health.recordFailure("a", health.tryAcquire("a"));
        rateLimiter.tryAcquire("b", new RateLimitPolicy(1, 0.0));

        DispatchResult result = dispatcher.dispatch(quote("AAPL"));

        assertEquals("c", result.provider());
        assertEquals(0, a.invocations());
        assertEquals(0, b.invocations());
        assertEquals(1, c.invocations());
        assertEquals(List.of(FailureKind.CIRCUIT_OPEN, FailureKind.RATE_LIMITED),
                result.attempts().stream().map(ProviderAttempt::kind).toList());
        assertEquals(1, statistics.snapshot().failovers());
    }

    @Test
    void exhaustionReportsEveryProviderInPriorityOrder() {
        StubAdapter c = register("c", 3);
        StubAdapter a = register("a", 1);
        StubAdapter b = register("b", 2);
        a.fail(ProviderErrorType.UNAVAILABLE);
        b.fail(ProviderErrorType.INVALID_RESPONSE);
        c.answerWith(command -> {
            throw new IllegalStateException("boom");
        });
        FailoverDispatcher dispatcher = dispatcher(5, clock);

        AllProvidersExhaustedException ex = assertThrows(AllProvidersExhaustedException.class,
                () -> dispatcher.dispatch(quote("AAPL")));

        assertEquals(List.of("a", "b", "c"), ex.getAttempts().stream().map(ProviderAttempt::provider).toList());
        assertEquals(List.of(FailureKind.UNAVAILABLE, FailureKind.INVALID_RESPONSE, FailureKind.UNAVAILABLE),
                ex.getAttempts().stream().map(ProviderAttempt::kind).toList());
        assertEquals(QUOTE, ex.getCapability());
        assertEquals(1, statistics.snapshot().exhaustions());
        assertEquals(1, health.getSnapshot("c").failedCalls());
    }

    @Test
    void deadlineShorterThanProviderLatencyFailsFast() {
        registry.register(QUOTE, ProviderDescriptor.of(
                StubAdapter.sleeping("slow", QUOTE, 500), 1, ProviderSettings.of(Duration.ofSeconds(5))));
        register("never", 2);
        Clock systemClock = Clock.systemUTC();
        FailoverDispatcher dispatcher = dispatcher(3, systemClock);

        long started = System.nanoTime();
        DeadlineExceededException ex = assertThrows(DeadlineExceededException.class, () -> dispatcher.dispatch(
                OperationRequest.within(QUOTE, Map.of("symbol", "AAPL"), Duration.ofMillis(100), systemClock)));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertTrue(elapsedMs < 450, "took " + elapsedMs + "ms");
        assertEquals(List.of("slow"), ex.getAttempts().stream().map(ProviderAttempt::provider).toList());
        assertEquals(FailureKind.TIMEOUT, ex.getAttempts().get(0).kind());
        assertEquals(0, health.getSnapshot("slow").failedCalls());
        assertEquals(1, statistics.snapshot().deadlineOverruns());
    }

    @Test
    void providerTimeoutFailsOverToNextCandidate() {
        registry.register(QUOTE, ProviderDescriptor.of(
                StubAdapter.sleeping("slow", QUOTE, 2_000), 1, ProviderSettings.of(Duration.ofMillis(50))));
        register("fast", 2);
        FailoverDispatcher dispatcher = dispatcher(3, Clock.systemUTC());

        DispatchResult result = dispatcher.dispatch(quote("AAPL"));

        assertEquals("fast", result.provider());
        assertEquals(FailureKind.TIMEOUT, result.attempts().get(0).kind());
        assertEquals(1, health.getSnapshot("slow").consecutiveFailures());
    }

    @Test
    void upstreamThrottlingIsNeutralForTheCircuit() {
        StubAdapter a = register("a", 1);
        register("b", 2);
        a.fail(ProviderErrorType.RATE_LIMITED);
        FailoverDispatcher dispatcher = dispatcher(1, clock);

        DispatchResult result = dispatcher.dispatch(quote("AAPL"));

        assertEquals("b", result.provider());
        assertEquals(FailureKind.RATE_LIMITED, result.attempts().get(0).kind());
        assertEquals(CircuitState.CLOSED, health.getSnapshot("a").circuitState());
        assertEquals(0, health.getSnapshot("a").failedCalls());
    }

    @Test
    void emptyAdapterResultCountsAsInvalidResponse() {
        StubAdapter a = register("a", 1);
        register("b", 2);
        a.answerWith(command -> null);
        FailoverDispatcher dispatcher = dispatcher(3, clock);

        DispatchResult result = dispatcher.dispatch(quote("AAPL"));

        assertEquals("b", result.provider());
        assertEquals(FailureKind.INVALID_RESPONSE, result.attempts().get(0).kind());
        assertEquals(1, health.getSnapshot("a").consecutiveFailures());
    }

    @Test
    void unregisteredProviderIsNotUsedByNextDispatch() {
        StubAdapter a = register("a", 1);
        StubAdapter b = register("b", 2);
        FailoverDispatcher dispatcher = dispatcher(3, clock);

        assertEquals("a", dispatcher.dispatch(quote("AAPL")).provider());
        registry.unregister(QUOTE, "a");
        assertEquals("b", dispatcher.dispatch(quote("MSFT")).provider());
        assertEquals(1, a.invocations());
        assertEquals(1, b.invocations());

        registry.unregister(QUOTE, "b");
        assertThrows(UnknownCapabilityException.class, () -> dispatcher.dispatch(quote("TSLA")));
    }

    @Test
    void failingProviderOpensThenFailoverResultIsCached() {
        StubAdapter a = register("a", 1);
        StubAdapter b = register("b", 2);
        a.fail(ProviderErrorType.UNAVAILABLE);
        FailoverDispatcher dispatcher = dispatcher(3, clock);

        for (int i = 1; i <= 3; i++) {
            if (i > 1) clock.advance(Duration.ofSeconds(3));
            assertEquals("b", dispatcher.dispatch(quote("WARMUP" + i)).provider());
        }
        assertEquals(CircuitState.OPEN, health.getSnapshot("a").circuitState());
        assertEquals(clock.instant().plusSeconds(1), health.getSnapshot("a").openUntil());

        DispatchResult fourth = dispatcher.dispatch(quote("AAPL"));
        assertEquals("b", fourth.provider());
        assertFalse(fourth.cacheHit());
        assertEquals(3, a.invocations());

        CacheEntry entry = cache.get(cacheKeys.keyFor(QUOTE, Map.of("symbol", "AAPL"))).orElseThrow();
        assertEquals(Duration.ofSeconds(60), entry.ttl());
        assertEquals("b", entry.provider());

        int invocationsBefore = a.invocations() + b.invocations();
        clock.advance(Duration.ofSeconds(5));
        DispatchResult fifth = dispatcher.dispatch(quote("AAPL"));

        assertTrue(fifth.cacheHit());
        assertEquals("b", fifth.provider());
        assertEquals(invocationsBefore, a.invocations() + b.invocations());
    }

    private StubAdapter register(String name, int priority) {
        return register(name, priority, null);
    }

    private StubAdapter register(String name, int priority, RateLimitPolicy policy) {
        StubAdapter adapter = new StubAdapter(name, Set.of(QUOTE), command -> StubAdapter.payload(name));
        registry.register(QUOTE, ProviderDescriptor.of(adapter, priority, new ProviderSettings(Duration.ofSeconds(2), policy)));
        return adapter;
    }

    private static OperationRequest quote(String symbol) {
        return OperationRequest.of(QUOTE, Map.of("symbol", symbol));
    }

    private FailoverDispatcher dispatcher(int failureThreshold, Clock dispatchClock) {
        AppProperties.CircuitBreaker breaker = new AppProperties.CircuitBreaker(
                failureThreshold, Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(60));
        AppProperties.Cache cacheProperties = new AppProperties.Cache(Duration.ofSeconds(60), 1_000L, Map.of());
        AppProperties properties = new AppProperties(
                new AppProperties.Orchestration(Duration.ofSeconds(5), 4, breaker, cacheProperties, Map.of()),
                null
        );

        health = new ProviderHealthService(breaker, dispatchClock);
        rateLimiter = new ProviderRateLimiter(dispatchClock);
        cache = new ResponseCache(1_000L, dispatchClock);
        cacheKeys = new CacheKeys(new ObjectMapper());
        statistics = new DispatchStatistics();
        return new FailoverDispatcher(
                registry,
                health,
                rateLimiter,
                cache,
                cacheKeys,
                new CacheTtlPolicy(cacheProperties),
                statistics,
                executor,
                dispatchClock,
                properties
        );
    }
}
