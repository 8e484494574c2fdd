/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Local per-provider quota. Independent of the circuit breaker: a denial only means the
 * caller should move on to the next candidate.
 *
 * <p>Buckets are created full on first use and rebuilt when a provider's policy changes.
 * A provider without a policy is never throttled.
 */
@Service
public class ProviderRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    public static final long UNLIMITED = -1;

    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProviderRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Consumes one token if available. The check and the consumption are one atomic step
     * per provider.
     */
    public boolean tryAcquire(String provider, RateLimitPolicy policy) {
        if (policy == null) return true;

        long nowMillis = clock.millis();
        boolean[] granted = new boolean[1];
        buckets.compute(provider, (k, current) -> {
            TokenBucket bucket = resolve(current, policy, nowMillis).refill(nowMillis);
            if (bucket.hasToken()) {
                granted[0] = true;
                return bucket.consume();
            }
            granted[0] = false;
            return bucket;
        });

        if (!granted[0]) {
            log.debug("Rate limit denied provider={} capacity={} refillPerSecond={}",
                    provider, policy.capacity(), policy.refillPerSecond());
        }
        return granted[0];
    }

    /**
     * Whole tokens available right now, or {@link #UNLIMITED} for providers without a policy.
     */
    public long headroom(String provider, RateLimitPolicy policy) {
        if (policy == null) return UNLIMITED;
        long nowMillis = clock.millis();
        TokenBucket current = buckets.get(provider);
        return resolve(current, policy, nowMillis).refill(nowMillis).wholeTokens();
    }

    public void reset(String provider) {
        buckets.remove(provider);
    }

    private static TokenBucket resolve(TokenBucket current, RateLimitPolicy policy, long nowMillis) {
        if (current == null || !current.policy().equals(policy)) {
            return TokenBucket.full(policy, nowMillis);
        }
        return current;
    }
}
