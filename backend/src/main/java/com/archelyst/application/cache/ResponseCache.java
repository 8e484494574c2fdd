/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.cache;

import com.archelyst.config.AppProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Provider-agnostic memoization of successful dispatches. Each entry carries its own TTL;
 * writes are atomic per key and the last writer wins.
 */
@Service
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    @Autowired
    public ResponseCache(AppProperties properties, Clock clock) {
        this(properties.orchestration().cache().maxEntries(), clock);
    }

    public ResponseCache(long maxEntries, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(() -> nanos(clock.instant()))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public CacheEntry put(String key, JsonNode value, String provider, Duration ttl) {
        CacheEntry entry = new CacheEntry(key, value, provider, clock.instant(), ttl);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return entry;
        }
        cache.put(key, entry);
        return entry;
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /**
     * Drops every entry of one capability.
     *
     * @return number of entries removed
     */
    public int invalidateCapability(String capability) {
        String prefix = CacheKeys.prefix(capability);
        int[] removed = new int[1];
        cache.asMap().keySet().removeIf(key -> {
            boolean match = key.startsWith(prefix);
            if (match) removed[0]++;
            return match;
        });
        log.info("Cache invalidated capability={} entries={}", capability, removed[0]);
        return removed[0];
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Cache invalidated entirely");
    }

    public CacheStatistics statistics() {
        CacheStats stats = cache.stats();
        return new CacheStatistics(cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.evictionCount(), stats.hitRate());
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    public record CacheStatistics(long size, long hits, long misses, long evictions, double hitRate) {}
}
