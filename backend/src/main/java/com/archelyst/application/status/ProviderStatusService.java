/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.status;

import com.archelyst.application.dispatch.DispatchStatistics;
import com.archelyst.application.health.HealthSnapshot;
import com.archelyst.application.health.ProviderHealthService;
import com.archelyst.application.ratelimit.ProviderRateLimiter;
import com.archelyst.application.registry.ProviderDescriptor;
import com.archelyst.application.registry.ProviderRegistry;
import com.archelyst.infrastructure.provider.ProviderDescription;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ProviderStatusService {
    private final ProviderRegistry registry;
    private final ProviderHealthService healthService;
    private final ProviderRateLimiter rateLimiter;
    private final DispatchStatistics dispatchStatistics;

    public ProviderStatusService(
            ProviderRegistry registry,
            ProviderHealthService healthService,
            ProviderRateLimiter rateLimiter,
            DispatchStatistics dispatchStatistics
    ) {
        this.registry = registry;
        this.healthService = healthService;
        this.rateLimiter = rateLimiter;
        this.dispatchStatistics = dispatchStatistics;
    }

    public List<ProviderSnapshot> snapshots() {
        Map<String, List<String>> routing = registry.routingTable();
        return registry.providers().stream()
                .map(descriptor -> snapshot(descriptor, registeredCapabilities(descriptor.name(), routing)))
                .toList();
    }

    public Map<String, List<String>> routingTable() {
        return registry.routingTable();
    }

    public DispatchStatistics.Totals dispatchStatistics() {
        return dispatchStatistics.snapshot();
    }

    /**
     * Closes the circuit and refills the bucket of one provider.
     */
    public void resetProvider(String provider) {
        healthService.reset(provider);
        rateLimiter.reset(provider);
    }

    public void resetStatistics() {
        healthService.resetStatistics();
        dispatchStatistics.reset();
    }

    private ProviderSnapshot snapshot(ProviderDescriptor descriptor, List<String> capabilities) {
        HealthSnapshot health = healthService.getSnapshot(descriptor.name());
        ProviderDescription description = descriptor.adapter().describe();
        long headroom = rateLimiter.headroom(descriptor.name(), descriptor.settings().rateLimit());
        return new ProviderSnapshot(
                descriptor.name(),
                description.vendor(),
                description.configured(),
                descriptor.priority(),
                capabilities,
                health.circuitState(),
                health.consecutiveFailures(),
                health.lastSuccessAt(),
                health.lastFailureAt(),
                health.openUntil(),
                headroom == ProviderRateLimiter.UNLIMITED ? null : headroom,
                health.totalCalls(),
                health.successfulCalls(),
                health.failedCalls(),
                health.successRate(),
                health.averageLatencyMs()
        );
    }

    private static List<String> registeredCapabilities(String provider, Map<String, List<String>> routing) {
        List<String> result = new ArrayList<>();
        routing.forEach((capability, providers) -> {
            if (providers.contains(provider)) result.add(capability);
        });
        return result;
    }
}
