/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.ratelimit;

/**
 * Token bucket settings for one provider.
 *
 * @param capacity        maximum tokens, also the burst size
 * @param refillPerSecond tokens added per second, may be fractional
 */
public record RateLimitPolicy(long capacity, double refillPerSecond) {
    public RateLimitPolicy {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPerSecond < 0) {
            throw new IllegalArgumentException("refillPerSecond must be non-negative");
        }
    }

    public static RateLimitPolicy perMinute(long requestsPerMinute, long burst) {
        return new RateLimitPolicy(burst, requestsPerMinute / 60.0);
    }
}
