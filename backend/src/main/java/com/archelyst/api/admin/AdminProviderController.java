/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api.admin;

import com.archelyst.api.ApiException;
import com.archelyst.application.cache.ResponseCache;
import com.archelyst.application.dispatch.DispatchStatistics;
import com.archelyst.application.health.HealthSnapshot;
import com.archelyst.application.health.ProviderHealthService;
import com.archelyst.application.registry.ProviderRegistry;
import com.archelyst.application.registry.ProviderRegistryConfigurer;
import com.archelyst.application.status.ProviderStatusService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Runtime control of the orchestration layer: hot swap, cache invalidation, statistics.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminProviderController {
    private final ProviderRegistry registry;
    private final ProviderRegistryConfigurer configurer;
    private final ProviderHealthService healthService;
    private final ProviderStatusService statusService;
    private final ResponseCache responseCache;

    public AdminProviderController(
            ProviderRegistry registry,
            ProviderRegistryConfigurer configurer,
            ProviderHealthService healthService,
            ProviderStatusService statusService,
            ResponseCache responseCache
    ) {
        this.registry = registry;
        this.configurer = configurer;
        this.healthService = healthService;
        this.statusService = statusService;
        this.responseCache = responseCache;
    }

    @GetMapping("/providers/health")
    public List<HealthSnapshot> health() {
        return healthService.getAllSnapshots();
    }

    @PutMapping("/providers/{capability}/{name}/priority")
    public Map<String, List<String>> updatePriority(
            @PathVariable("capability") String capability,
            @PathVariable("name") String name,
            @Valid @RequestBody PriorityRequest req
    ) {
        if (registry.find(capability, name).isEmpty()) {
            throw new ApiException(HttpStatus.NOT_FOUND, "Provider " + name + " is not registered for " + capability);
        }
        registry.updatePriority(capability, name, req.priority());
        return registry.routingTable();
    }

    @DeleteMapping("/providers/{capability}/{name}")
    public ResponseEntity<Void> unregister(
            @PathVariable("capability") String capability,
            @PathVariable("name") String name
    ) {
        if (!registry.unregister(capability, name)) {
            throw new ApiException(HttpStatus.NOT_FOUND, "Provider " + name + " is not registered for " + capability);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/providers/reload")
    public ProviderRegistryConfigurer.ReloadResult reload() {
        return configurer.reload();
    }

    @PostMapping("/providers/{name}/reset")
    public ResponseEntity<Void> resetProvider(@PathVariable("name") String name) {
        statusService.resetProvider(name);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache")
    public ResponseCache.CacheStatistics cacheStatistics() {
        return responseCache.statistics();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateCache() {
        responseCache.invalidateAll();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{capability}")
    public Map<String, Integer> invalidateCapability(@PathVariable("capability") String capability) {
        return Map.of("invalidated", responseCache.invalidateCapability(capability));
    }

    @GetMapping("/statistics")
    public DispatchStatistics.Totals statistics() {
        return statusService.dispatchStatistics();
    }

    @PostMapping("/statistics/reset")
    public ResponseEntity<Void> resetStatistics() {
        statusService.resetStatistics();
        return ResponseEntity.noContent().build();
    }

    public record PriorityRequest(@NotNull Integer priority) {}
}
