/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * @param provider provider that produced the value, reported to callers but not part of the key
 */
public record CacheEntry(
        String key,
        JsonNode value,
        String provider,
        Instant fetchedAt,
        Duration ttl
) {}
