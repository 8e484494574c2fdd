/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.ratelimit;

/**
 * Immutable token bucket state. Tokens are fractional so slow refill rates (a few calls per
 * minute) accumulate between checks instead of rounding down to nothing.
 *
 * @param policy           settings the bucket was created with
 * @param tokens           tokens currently available
 * @param lastRefillMillis epoch millis of the last refill
 */
public record TokenBucket(RateLimitPolicy policy, double tokens, long lastRefillMillis) {

    public static TokenBucket full(RateLimitPolicy policy, long nowMillis) {
        return new TokenBucket(policy, policy.capacity(), nowMillis);
    }

    public TokenBucket refill(long nowMillis) {
        long elapsed = nowMillis - lastRefillMillis;
        if (elapsed <= 0 || tokens >= policy.capacity()) {
            return new TokenBucket(policy, tokens, Math.max(lastRefillMillis, nowMillis));
        }
        double added = elapsed / 1000.0 * policy.refillPerSecond();
        return new TokenBucket(policy, Math.min(policy.capacity(), tokens + added), nowMillis);
    }

    public boolean hasToken() {
        return tokens >= 1.0;
    }

    public TokenBucket consume() {
        if (!hasToken()) {
            throw new IllegalStateException("No tokens available to consume");
        }
        return new TokenBucket(policy, tokens - 1.0, lastRefillMillis);
    }

    public long wholeTokens() {
        return (long) Math.floor(tokens);
    }
}
