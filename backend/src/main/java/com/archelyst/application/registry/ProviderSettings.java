/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.registry;

import com.archelyst.application.ratelimit.RateLimitPolicy;

import java.time.Duration;

/**
 * @param timeout   upper bound for one invocation, further bounded by the request deadline
 * @param rateLimit local quota, {@code null} for unthrottled providers
 */
public record ProviderSettings(Duration timeout, RateLimitPolicy rateLimit) {
    public ProviderSettings {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static ProviderSettings of(Duration timeout) {
        return new ProviderSettings(timeout, null);
    }
}
