/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.health;

import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider circuit breaker and call statistics. Each provider's state is guarded by its
 * own monitor, so providers never contend with each other.
 *
 * <ul>
 *   <li>CLOSED: calls pass. Failures within the window accumulate; reaching the threshold opens.</li>
 *   <li>OPEN: calls are rejected until {@code openUntil}, then one trial is let through.</li>
 *   <li>HALF_OPEN: the trial decides. Success closes and resets the backoff, failure reopens
 *   with the backoff doubled up to the cap.</li>
 * </ul>
 */
@Service
public class ProviderHealthService {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthService.class);
    private static final double LATENCY_ALPHA = 0.1;

    private final AppProperties.CircuitBreaker policy;
    private final Clock clock;
    private final Map<String, HealthState> states = new ConcurrentHashMap<>();

    @Autowired
    public ProviderHealthService(AppProperties properties, Clock clock) {
        this(properties.orchestration().circuitBreaker(), clock);
    }

    public ProviderHealthService(AppProperties.CircuitBreaker policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public CircuitPermit tryAcquire(String provider) {
        HealthState state = state(provider);
        synchronized (state) {
            Instant now = clock.instant();
            switch (state.phase) {
                case CLOSED:
                    return CircuitPermit.NORMAL;
                case OPEN:
                    if (now.isBefore(state.openUntil)) {
                        return CircuitPermit.REJECTED;
                    }
                    state.phase = CircuitState.HALF_OPEN;
                    state.trialInFlight = true;
                    log.info("Circuit half-open provider={} openings={}", provider, state.consecutiveOpenings);
                    return CircuitPermit.TRIAL;
                case HALF_OPEN:
                default:
                    if (state.trialInFlight) {
                        return CircuitPermit.REJECTED;
                    }
                    state.trialInFlight = true;
                    return CircuitPermit.TRIAL;
            }
        }
    }

    public void recordSuccess(String provider, CircuitPermit permit, long latencyMs) {
        HealthState state = state(provider);
        synchronized (state) {
            Instant now = clock.instant();
            state.totalCalls++;
            state.successfulCalls++;
            state.lastSuccessAt = now;
            state.averageLatencyMs = state.averageLatencyMs < 0
                    ? latencyMs
                    : LATENCY_ALPHA * latencyMs + (1 - LATENCY_ALPHA) * state.averageLatencyMs;

            if (permit == CircuitPermit.TRIAL && state.phase == CircuitState.HALF_OPEN) {
                state.phase = CircuitState.CLOSED;
                state.consecutiveFailures = 0;
                state.consecutiveOpenings = 0;
                state.recentFailures.clear();
                state.openUntil = null;
                state.trialInFlight = false;
                log.info("Circuit closed provider={}", provider);
            } else if (state.phase == CircuitState.CLOSED) {
                state.consecutiveFailures = 0;
                state.recentFailures.clear();
            }
        }
    }

    public void recordFailure(String provider, CircuitPermit permit) {
        HealthState state = state(provider);
        synchronized (state) {
            Instant now = clock.instant();
            state.totalCalls++;
            state.failedCalls++;

            if (permit == CircuitPermit.TRIAL && state.phase == CircuitState.HALF_OPEN) {
                state.trialInFlight = false;
                open(provider, state, now);
            } else if (state.phase == CircuitState.CLOSED) {
                Instant windowStart = now.minus(policy.failureWindow());
                while (!state.recentFailures.isEmpty() && state.recentFailures.peekFirst().isBefore(windowStart)) {
                    state.recentFailures.removeFirst();
                }
                state.recentFailures.addLast(now);
                while (state.recentFailures.size() > policy.failureThreshold()) {
                    state.recentFailures.removeFirst();
                }
                state.consecutiveFailures = state.recentFailures.size();
                if (state.consecutiveFailures >= policy.failureThreshold()) {
                    open(provider, state, now);
                }
            }
            state.lastFailureAt = now;
        }
    }

    /**
     * Outcome that says nothing about provider health, such as upstream throttling or a call
     * cut short by the caller's deadline. Releases a trial slot without deciding the circuit.
     */
    public void recordNeutral(String provider, CircuitPermit permit) {
        HealthState state = state(provider);
        synchronized (state) {
            state.totalCalls++;
            if (permit == CircuitPermit.TRIAL && state.phase == CircuitState.HALF_OPEN) {
                state.trialInFlight = false;
            }
        }
    }

    public HealthSnapshot getSnapshot(String provider) {
        HealthState state = state(provider);
        synchronized (state) {
            return state.toSnapshot(provider, effectiveState(state, clock.instant()));
        }
    }

    public List<HealthSnapshot> getAllSnapshots() {
        return states.keySet().stream().sorted().map(this::getSnapshot).toList();
    }

    /**
     * Forces the provider back to a fresh CLOSED state, statistics included.
     */
    public void reset(String provider) {
        states.put(provider, new HealthState());
        log.info("Circuit reset provider={}", provider);
    }

    public void resetStatistics() {
        for (HealthState state : states.values()) {
            synchronized (state) {
                state.totalCalls = 0;
                state.successfulCalls = 0;
                state.failedCalls = 0;
                state.averageLatencyMs = -1;
            }
        }
    }

    Duration backoff(int openings) {
        long baseMillis = policy.baseBackoff().toMillis();
        long capMillis = policy.maxBackoff().toMillis();
        int exponent = Math.max(0, openings - 1);
        if (exponent >= 31 || baseMillis > (capMillis >> exponent)) {
            return policy.maxBackoff();
        }
        return Duration.ofMillis(Math.min(baseMillis << exponent, capMillis));
    }

    private void open(String provider, HealthState state, Instant now) {
        state.consecutiveOpenings++;
        Duration backoff = backoff(state.consecutiveOpenings);
        state.phase = CircuitState.OPEN;
        state.openUntil = now.plus(backoff);
        log.warn("Circuit opened provider={} failures={} openings={} backoffMs={}",
                provider, state.consecutiveFailures, state.consecutiveOpenings, backoff.toMillis());
    }

    private CircuitState effectiveState(HealthState state, Instant now) {
        if (state.phase != CircuitState.OPEN) return state.phase;
        if (state.openUntil != null && !now.isBefore(state.openUntil)) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.OPEN;
    }

    private HealthState state(String provider) {
        return states.computeIfAbsent(provider, p -> new HealthState());
    }

    private static final class HealthState {
        private CircuitState phase = CircuitState.CLOSED;
        private int consecutiveFailures;
        // failures inside the window since the last success, at most the threshold
        private final Deque<Instant> recentFailures = new ArrayDeque<>();
        private int consecutiveOpenings;
        private boolean trialInFlight;
        private Instant lastSuccessAt;
        private Instant lastFailureAt;
        private Instant openUntil;
        private long totalCalls;
        private long successfulCalls;
        private long failedCalls;
        private double averageLatencyMs = -1;

        private HealthSnapshot toSnapshot(String provider, CircuitState effective) {
            long decided = successfulCalls + failedCalls;
            return new HealthSnapshot(
                    provider,
                    effective,
                    consecutiveFailures,
                    consecutiveOpenings,
                    lastSuccessAt,
                    lastFailureAt,
                    openUntil,
                    totalCalls,
                    successfulCalls,
                    failedCalls,
                    decided == 0 ? 1.0 : (double) successfulCalls / decided,
                    averageLatencyMs < 0 ? 0 : averageLatencyMs
            );
        }
    }
}
