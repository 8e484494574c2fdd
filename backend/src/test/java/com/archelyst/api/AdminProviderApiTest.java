/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api;

import com.archelyst.application.registry.ProviderDescriptor;
import com.archelyst.application.registry.ProviderRegistry;
import com.archelyst.application.registry.ProviderSettings;
import com.archelyst.infrastructure.provider.ProviderErrorType;
import com.archelyst.support.StubAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class AdminProviderApiTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ProviderRegistry registry;

    @Test
    void exhaustedProvidersAre502WithAttempts() {
        registry.register("news", ProviderDescriptor.of(
                StubAdapter.failing("wire-a", "news", ProviderErrorType.UNAVAILABLE), 1, ProviderSettings.of(Duration.ofSeconds(1))));
        registry.register("news", ProviderDescriptor.of(
                StubAdapter.failing("wire-b", "news", ProviderErrorType.INVALID_RESPONSE), 2, ProviderSettings.of(Duration.ofSeconds(1))));

        ResponseEntity<Map> res = restTemplate.postForEntity("/api/v1/dispatch/news", Map.of("params", Map.of()), Map.class);

        assertEquals(HttpStatus.BAD_GATEWAY, res.getStatusCode());
        assertEquals("ALL_PROVIDERS_EXHAUSTED", res.getBody().get("code"));
        List<Map<String, Object>> attempts = (List<Map<String, Object>>) res.getBody().get("attempts");
        assertEquals(2, attempts.size());
        assertEquals("wire-a", attempts.get(0).get("provider"));
        assertEquals("UNAVAILABLE", attempts.get(0).get("kind"));
        assertEquals("INVALID_RESPONSE", attempts.get(1).get("kind"));
    }

    @Test
    void unregisterThenReloadRestoresConfiguredProviders() {
        ResponseEntity<Void> removed = restTemplate.exchange(
                "/api/admin/providers/quote/demo", HttpMethod.DELETE, HttpEntity.EMPTY, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, removed.getStatusCode());

        ResponseEntity<Map> missing = restTemplate.getForEntity("/api/v1/market/quote/ORCL", Map.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());

        ResponseEntity<Map> reload = restTemplate.postForEntity("/api/admin/providers/reload", null, Map.class);
        assertEquals(HttpStatus.OK, reload.getStatusCode());
        assertEquals(List.of("demo"), ((Map) reload.getBody().get("routing")).get("quote"));

        ResponseEntity<Map> restored = restTemplate.getForEntity("/api/v1/market/quote/ORCL", Map.class);
        assertEquals(HttpStatus.OK, restored.getStatusCode());
    }

    @Test
    void priorityUpdateReordersCandidates() {
        registry.register("quote", ProviderDescriptor.of(
                StubAdapter.answering("backup", "quote"), 50, ProviderSettings.of(Duration.ofSeconds(1))));

        ResponseEntity<Map> res = restTemplate.exchange(
                "/api/admin/providers/quote/demo/priority",
                HttpMethod.PUT,
                new HttpEntity<>(Map.of("priority", 100)),
                Map.class
        );

        assertEquals(HttpStatus.OK, res.getStatusCode());
        assertEquals(List.of("backup", "demo"), res.getBody().get("quote"));

        ResponseEntity<Map> unknown = restTemplate.exchange(
                "/api/admin/providers/quote/nobody/priority",
                HttpMethod.PUT,
                new HttpEntity<>(Map.of("priority", 1)),
                Map.class
        );
        assertEquals(HttpStatus.NOT_FOUND, unknown.getStatusCode());
    }

    @Test
    void cacheInvalidationForcesFreshDispatch() {
        restTemplate.exchange("/api/admin/cache", HttpMethod.DELETE, HttpEntity.EMPTY, Void.class);
        restTemplate.getForEntity("/api/v1/market/profile/AMZN", Map.class);
        assertEquals(true, restTemplate.getForEntity("/api/v1/market/profile/AMZN", Map.class).getBody().get("cacheHit"));

        ResponseEntity<Map> invalidated = restTemplate.exchange(
                "/api/admin/cache/profile", HttpMethod.DELETE, HttpEntity.EMPTY, Map.class);
        assertEquals(1, invalidated.getBody().get("invalidated"));

        assertEquals(false, restTemplate.getForEntity("/api/v1/market/profile/AMZN", Map.class).getBody().get("cacheHit"));
    }

    @Test
    void statisticsCanBeReadAndReset() {
        restTemplate.postForEntity("/api/admin/statistics/reset", null, Void.class);
        restTemplate.exchange("/api/admin/cache", HttpMethod.DELETE, HttpEntity.EMPTY, Void.class);
        restTemplate.getForEntity("/api/v1/market/quote/SAP", Map.class);
        restTemplate.getForEntity("/api/v1/market/quote/SAP", Map.class);

        Map stats = restTemplate.getForEntity("/api/admin/statistics", Map.class).getBody();
        assertNotNull(stats);
        assertEquals(2, stats.get("dispatches"));
        assertEquals(1, stats.get("cacheHits"));

        ResponseEntity<Void> reset = restTemplate.postForEntity("/api/admin/statistics/reset", null, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, reset.getStatusCode());
        assertEquals(0, restTemplate.getForEntity("/api/admin/statistics", Map.class).getBody().get("dispatches"));

        ResponseEntity<List> health = restTemplate.getForEntity("/api/admin/providers/health", List.class);
        assertEquals(HttpStatus.OK, health.getStatusCode());
    }
}
