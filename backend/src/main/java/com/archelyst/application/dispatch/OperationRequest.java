/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.archelyst.domain.model.Capabilities;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param deadline absolute instant by which the whole dispatch must finish, {@code null}
 *                 for the configured default
 */
public record OperationRequest(
        String capability,
        Map<String, Object> params,
        Instant deadline
) {
    public OperationRequest {
        capability = Capabilities.normalize(capability);
        params = copyWithoutNulls(params);
    }

    public static OperationRequest of(String capability, Map<String, Object> params) {
        return new OperationRequest(capability, params, null);
    }

    public static OperationRequest within(String capability, Map<String, Object> params, Duration budget, Clock clock) {
        if (budget == null) return of(capability, params);
        if (budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        return new OperationRequest(capability, params, clock.instant().plus(budget));
    }

    // an explicit null and an absent key mean the same thing, and share a cache key
    private static Map<String, Object> copyWithoutNulls(Map<String, Object> params) {
        if (params == null || params.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key != null && value != null) copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
