/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Orchestration orchestration,
        Vendors vendors
) {
    public AppProperties {
        orchestration = orchestration == null ? Orchestration.defaults() : orchestration;
        vendors = vendors == null ? new Vendors(null, null, null) : vendors;
    }

    public record Orchestration(
            Duration defaultDeadline,
            Integer dispatchThreads,
            CircuitBreaker circuitBreaker,
            Cache cache,
            Map<String, Provider> providers
    ) {
        public Orchestration {
            defaultDeadline = defaultDeadline == null ? Duration.ofSeconds(30) : defaultDeadline;
            dispatchThreads = dispatchThreads == null || dispatchThreads < 1 ? 16 : dispatchThreads;
            circuitBreaker = circuitBreaker == null ? CircuitBreaker.defaults() : circuitBreaker;
            cache = cache == null ? Cache.defaults() : cache;
            providers = providers == null ? Map.of() : providers;
        }

        static Orchestration defaults() {
            return new Orchestration(null, null, null, null, null);
        }
    }

    /**
     * @param failureThreshold consecutive failures that open the circuit
     * @param failureWindow    failures further apart than this do not accumulate
     * @param baseBackoff      first open period, doubled on each consecutive opening
     * @param maxBackoff       cap for the open period
     */
    public record CircuitBreaker(
            Integer failureThreshold,
            Duration failureWindow,
            Duration baseBackoff,
            Duration maxBackoff
    ) {
        public CircuitBreaker {
            failureThreshold = failureThreshold == null || failureThreshold < 1 ? 5 : failureThreshold;
            failureWindow = failureWindow == null ? Duration.ofSeconds(60) : failureWindow;
            baseBackoff = baseBackoff == null ? Duration.ofSeconds(1) : baseBackoff;
            maxBackoff = maxBackoff == null ? Duration.ofSeconds(60) : maxBackoff;
            if (maxBackoff.compareTo(baseBackoff) < 0) {
                throw new IllegalArgumentException("max-backoff must not be shorter than base-backoff");
            }
        }

        public static CircuitBreaker defaults() {
            return new CircuitBreaker(null, null, null, null);
        }
    }

    public record Cache(
            Duration defaultTtl,
            Long maxEntries,
            Map<String, Duration> ttl
    ) {
        public Cache {
            defaultTtl = defaultTtl == null ? Duration.ofSeconds(60) : defaultTtl;
            maxEntries = maxEntries == null || maxEntries < 1 ? 10_000L : maxEntries;
            ttl = ttl == null ? Map.of() : Map.copyOf(ttl);
        }

        static Cache defaults() {
            return new Cache(null, null, null);
        }
    }

    public record Provider(
            Boolean enabled,
            Integer priority,
            List<String> capabilities,
            Duration timeout,
            RateLimit rateLimit
    ) {
        public Provider {
            enabled = enabled == null || enabled;
            priority = priority == null ? 100 : priority;
            capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }

    /**
     * Token bucket settings. A missing block means the provider is not throttled locally.
     */
    public record RateLimit(long capacity, double refillPerSecond) {}

    public record Vendors(Fmp fmp, Yahoo yahoo, OpenAi openai) {
        public Vendors {
            fmp = fmp == null ? new Fmp(null, null) : fmp;
            yahoo = yahoo == null ? new Yahoo(null) : yahoo;
            openai = openai == null ? new OpenAi(null, null, null) : openai;
        }

        public record Fmp(String apiKey, String baseUrl) {
            public Fmp {
                baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://financialmodelingprep.com/api/v3" : baseUrl;
            }
        }

        public record Yahoo(String baseUrl) {
            public Yahoo {
                baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://query1.finance.yahoo.com" : baseUrl;
            }
        }

        public record OpenAi(String apiKey, String baseUrl, String model) {
            public OpenAi {
                baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com/v1" : baseUrl;
                model = model == null || model.isBlank() ? "gpt-4o-mini" : model;
            }
        }
    }
}
