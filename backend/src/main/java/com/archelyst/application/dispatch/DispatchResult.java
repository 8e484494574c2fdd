/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * @param attempts candidates skipped or failed before {@code provider} answered; empty on a cache hit
 */
public record DispatchResult(
        JsonNode value,
        String provider,
        boolean cacheHit,
        Instant fetchedAt,
        List<ProviderAttempt> attempts
) {
    public DispatchResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }
}
