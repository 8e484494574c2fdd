/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.health;

import com.archelyst.domain.model.CircuitState;

import java.time.Instant;

public record HealthSnapshot(
        String provider,
        CircuitState circuitState,
        int consecutiveFailures,
        int consecutiveOpenings,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        Instant openUntil,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        double successRate,
        double averageLatencyMs
) {}
