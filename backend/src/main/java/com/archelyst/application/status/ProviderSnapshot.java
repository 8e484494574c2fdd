/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.status;

import com.archelyst.domain.model.CircuitState;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one provider for status endpoints.
 *
 * @param rateLimitHeadroom whole tokens available now, {@code null} when the provider is not throttled
 */
public record ProviderSnapshot(
        String provider,
        String vendor,
        boolean configured,
        int priority,
        List<String> capabilities,
        CircuitState circuitState,
        int consecutiveFailures,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        Instant openUntil,
        Long rateLimitHeadroom,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        double successRate,
        double averageLatencyMs
) {}
