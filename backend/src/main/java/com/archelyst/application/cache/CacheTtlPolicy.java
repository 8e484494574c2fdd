/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.cache;

import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.Capabilities;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * TTL per capability. Built-in values follow how fast each kind of data goes stale;
 * {@code app.orchestration.cache.ttl} overrides them and {@code default-ttl} covers the rest.
 */
@Component
public class CacheTtlPolicy {
    static final Map<String, Duration> BUILT_IN = Map.of(
            Capabilities.REAL_TIME, Duration.ofSeconds(30),
            Capabilities.QUOTE, Duration.ofSeconds(60),
            Capabilities.MARKET_OVERVIEW, Duration.ofMinutes(5),
            Capabilities.SEARCH, Duration.ofMinutes(15),
            Capabilities.MARKET_INSIGHT, Duration.ofMinutes(30),
            Capabilities.PROFILE, Duration.ofHours(1),
            Capabilities.HISTORICAL, Duration.ofHours(4)
    );

    private final Map<String, Duration> ttl;
    private final Duration defaultTtl;

    @Autowired
    public CacheTtlPolicy(AppProperties properties) {
        this(properties.orchestration().cache());
    }

    public CacheTtlPolicy(AppProperties.Cache cache) {
        Map<String, Duration> merged = new HashMap<>(BUILT_IN);
        cache.ttl().forEach((capability, value) -> merged.put(Capabilities.normalize(capability), value));
        this.ttl = Map.copyOf(merged);
        this.defaultTtl = cache.defaultTtl();
    }

    public Duration ttlFor(String capability) {
        return ttl.getOrDefault(Capabilities.normalize(capability), defaultTtl);
    }
}
