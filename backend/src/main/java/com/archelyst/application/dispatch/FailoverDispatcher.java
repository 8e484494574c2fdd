/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.archelyst.application.cache.CacheEntry;
import com.archelyst.application.cache.CacheKeys;
import com.archelyst.application.cache.CacheTtlPolicy;
import com.archelyst.application.cache.ResponseCache;
import com.archelyst.application.health.CircuitPermit;
import com.archelyst.application.health.ProviderHealthService;
import com.archelyst.application.ratelimit.ProviderRateLimiter;
import com.archelyst.application.registry.ProviderDescriptor;
import com.archelyst.application.registry.ProviderRegistry;
import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.FailureKind;
import com.archelyst.infrastructure.provider.InvokeCommand;
import com.archelyst.infrastructure.provider.ProviderErrorType;
import com.archelyst.infrastructure.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers an operation from the cache or from the first healthy provider that succeeds.
 *
 * <p>Per candidate, in registry order: local quota, circuit breaker, then the invocation,
 * bounded by the provider timeout and by what is left of the caller's deadline. Transient
 * failures move on to the next candidate; callers only see exhaustion or a deadline overrun,
 * each carrying every attempt made.
 */
@Service
public class FailoverDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FailoverDispatcher.class);

    private final ProviderRegistry registry;
    private final ProviderHealthService healthService;
    private final ProviderRateLimiter rateLimiter;
    private final ResponseCache cache;
    private final CacheKeys cacheKeys;
    private final CacheTtlPolicy ttlPolicy;
    private final DispatchStatistics statistics;
    private final ExecutorService providerExecutor;
    private final Clock clock;
    private final Duration defaultDeadline;

    public FailoverDispatcher(
            ProviderRegistry registry,
            ProviderHealthService healthService,
            ProviderRateLimiter rateLimiter,
            ResponseCache cache,
            CacheKeys cacheKeys,
            CacheTtlPolicy ttlPolicy,
            DispatchStatistics statistics,
            @Qualifier("providerExecutor") ExecutorService providerExecutor,
            Clock clock,
            AppProperties properties
    ) {
        this.registry = registry;
        this.healthService = healthService;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.cacheKeys = cacheKeys;
        this.ttlPolicy = ttlPolicy;
        this.statistics = statistics;
        this.providerExecutor = providerExecutor;
        this.clock = clock;
        this.defaultDeadline = properties.orchestration().defaultDeadline();
    }

    public DispatchResult dispatch(OperationRequest request) {
        String capability = request.capability();
        Instant deadline = request.deadline() != null ? request.deadline() : clock.instant().plus(defaultDeadline);
        statistics.recordDispatch();

        String key = cacheKeys.keyFor(capability, request.params());
        Optional<CacheEntry> cached = cache.get(key);
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            statistics.recordCacheHit();
            log.info("Dispatch served capability={} provider={} cacheHit=true attempts=0", capability, entry.provider());
            return new DispatchResult(entry.value(), entry.provider(), true, entry.fetchedAt(), List.of());
        }

        List<ProviderDescriptor> candidates = registry.candidates(capability);
        List<ProviderAttempt> attempts = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            ProviderDescriptor candidate = candidates.get(i);
            String name = candidate.name();

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw deadlineExceeded(capability, deadline, attempts);
            }

            if (!rateLimiter.tryAcquire(name, candidate.settings().rateLimit())) {
                attempts.add(ProviderAttempt.skipped(name, FailureKind.RATE_LIMITED, "Local rate limit reached"));
                continue;
            }

            CircuitPermit permit = healthService.tryAcquire(name);
            if (!permit.granted()) {
                attempts.add(ProviderAttempt.skipped(name, FailureKind.CIRCUIT_OPEN, "Circuit open"));
                continue;
            }

            Duration providerTimeout = candidate.settings().timeout();
            boolean boundedByDeadline = remaining.compareTo(providerTimeout) < 0;
            Duration timeout = boundedByDeadline ? remaining : providerTimeout;
            InvokeCommand command = new InvokeCommand(capability, request.params(), timeout);

            long started = System.nanoTime();
            try {
                JsonNode value = invoke(candidate, command);
                long elapsedMs = elapsedMillis(started);
                healthService.recordSuccess(name, permit, elapsedMs);
                CacheEntry entry = cache.put(key, value, name, ttlPolicy.ttlFor(capability));
                if (i > 0) {
                    statistics.recordFailover();
                }
                log.info("Dispatch served capability={} provider={} cacheHit=false attempts={} latencyMs={}",
                        capability, name, attempts.size(), elapsedMs);
                return new DispatchResult(value, name, false, entry.fetchedAt(), attempts);
            } catch (ProviderException e) {
                long elapsedMs = elapsedMillis(started);
                FailureKind kind = e.getFailureKind();
                attempts.add(new ProviderAttempt(name, kind, e.getSafeMessage(), elapsedMs));

                if (kind == FailureKind.TIMEOUT && (boundedByDeadline || Thread.currentThread().isInterrupted())) {
                    // cut short by the caller, not the provider's fault
                    healthService.recordNeutral(name, permit);
                    throw deadlineExceeded(capability, deadline, attempts);
                }
                if (e.countsAgainstHealth()) {
                    healthService.recordFailure(name, permit);
                } else {
                    healthService.recordNeutral(name, permit);
                }
                logFailure(capability, name, kind, e, elapsedMs);
            }
        }

        statistics.recordExhaustion();
        long invoked = attempts.stream().filter(a -> !a.kind().isLocalSkip()).count();
        log.warn("Dispatch exhausted capability={} candidates={} invoked={} attempts={}",
                capability, candidates.size(), invoked, attempts);
        throw new AllProvidersExhaustedException(capability, attempts);
    }

    /**
     * Runs the adapter on the provider executor and waits at most the command timeout. A call
     * that does not finish in time is cancelled and its eventual result discarded.
     */
    private JsonNode invoke(ProviderDescriptor candidate, InvokeCommand command) {
        String name = candidate.name();
        Future<JsonNode> future;
        try {
            future = providerExecutor.submit(withMdc(() -> candidate.adapter().invoke(command)));
        } catch (RejectedExecutionException e) {
            throw new ProviderException(name, ProviderErrorType.UNAVAILABLE, "Provider executor saturated", e);
        }

        try {
            JsonNode value = future.get(command.timeout().toNanos(), TimeUnit.NANOSECONDS);
            if (value == null || value.isNull() || value.isMissingNode()) {
                throw new ProviderException(name, ProviderErrorType.INVALID_RESPONSE, "Provider returned no value");
            }
            return value;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(name, ProviderErrorType.TIMEOUT,
                    "Timed out after " + command.timeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(name, ProviderErrorType.TIMEOUT, "Dispatch interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderException(name, ProviderErrorType.UNAVAILABLE, "Unexpected provider failure", cause);
        }
    }

    private DeadlineExceededException deadlineExceeded(String capability, Instant deadline, List<ProviderAttempt> attempts) {
        statistics.recordDeadlineOverrun();
        log.warn("Dispatch deadline exceeded capability={} deadline={} attempts={}", capability, deadline, attempts);
        return new DeadlineExceededException(capability, deadline, attempts);
    }

    private static void logFailure(String capability, String provider, FailureKind kind, ProviderException e, long elapsedMs) {
        if (kind == FailureKind.INVALID_RESPONSE) {
            log.error("Provider failed capability={} provider={} kind={} elapsedMs={} message={}",
                    capability, provider, kind, elapsedMs, e.getSafeMessage());
        } else {
            log.warn("Provider failed capability={} provider={} kind={} elapsedMs={} message={}",
                    capability, provider, kind, elapsedMs, e.getSafeMessage());
        }
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) MDC.setContextMap(context);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
