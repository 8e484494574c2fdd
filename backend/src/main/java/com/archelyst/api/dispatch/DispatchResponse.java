/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api.dispatch;

import com.archelyst.application.dispatch.DispatchResult;
import com.archelyst.application.dispatch.ProviderAttempt;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record DispatchResponse(
        String capability,
        String provider,
        boolean cacheHit,
        Instant fetchedAt,
        JsonNode data,
        List<ProviderAttempt> attempts
) {
    static DispatchResponse from(String capability, DispatchResult result) {
        return new DispatchResponse(
                capability,
                result.provider(),
                result.cacheHit(),
                result.fetchedAt(),
                result.value(),
                result.attempts()
        );
    }
}
