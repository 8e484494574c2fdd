/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.registry;

import com.archelyst.application.ratelimit.RateLimitPolicy;
import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.Capabilities;
import com.archelyst.infrastructure.provider.ProviderAdapter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the registry from {@code app.orchestration.providers} and the adapter beans.
 * Re-applying the configuration is the hot-swap path: descriptors are replaced in place
 * and registrations that are no longer configured are removed.
 */
@Component
public class ProviderRegistryConfigurer {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryConfigurer.class);

    private final ProviderRegistry registry;
    private final AppProperties properties;
    private final Map<String, ProviderAdapter> adaptersByName;

    public ProviderRegistryConfigurer(ProviderRegistry registry, AppProperties properties, List<ProviderAdapter> adapters) {
        this.registry = registry;
        this.properties = properties;
        this.adaptersByName = index(adapters == null ? List.of() : adapters);
    }

    @PostConstruct
    public void init() {
        ReloadResult result = reload();
        log.info("Provider registry initialized registered={} routing={}", result.registered(), result.routing());
    }

    public synchronized ReloadResult reload() {
        return apply(properties.orchestration().providers());
    }

    synchronized ReloadResult apply(Map<String, AppProperties.Provider> configured) {
        Map<String, List<ProviderDescriptor>> desired = desiredRegistrations(configured);

        int registered = 0;
        for (Map.Entry<String, List<ProviderDescriptor>> entry : desired.entrySet()) {
            for (ProviderDescriptor descriptor : entry.getValue()) {
                registry.register(entry.getKey(), descriptor);
                registered++;
            }
        }

        int removed = 0;
        for (Map.Entry<String, List<String>> entry : registry.routingTable().entrySet()) {
            Set<String> keep = new LinkedHashSet<>();
            desired.getOrDefault(entry.getKey(), List.of()).forEach(d -> keep.add(d.name()));
            for (String name : entry.getValue()) {
                if (!keep.contains(name) && registry.unregister(entry.getKey(), name)) {
                    removed++;
                }
            }
        }

        return new ReloadResult(registered, removed, registry.routingTable());
    }

    public Set<String> adapterNames() {
        return adaptersByName.keySet();
    }

    private Map<String, List<ProviderDescriptor>> desiredRegistrations(Map<String, AppProperties.Provider> configured) {
        Map<String, List<ProviderDescriptor>> desired = new LinkedHashMap<>();
        for (Map.Entry<String, AppProperties.Provider> entry : configured.entrySet()) {
            String name = entry.getKey();
            AppProperties.Provider config = entry.getValue();
            if (!config.enabled()) {
                log.info("Provider disabled by configuration provider={}", name);
                continue;
            }

            ProviderAdapter adapter = adaptersByName.get(name);
            if (adapter == null) {
                log.warn("Configured provider has no adapter provider={} known={}", name, adaptersByName.keySet());
                continue;
            }

            List<String> capabilities = resolveCapabilities(name, config, adapter);
            ProviderSettings settings = new ProviderSettings(config.timeout(), toPolicy(config.rateLimit()));
            ProviderDescriptor descriptor = new ProviderDescriptor(name, capabilities, config.priority(), settings, adapter);
            for (String capability : capabilities) {
                desired.computeIfAbsent(capability, k -> new ArrayList<>()).add(descriptor);
            }
        }
        return desired;
    }

    private List<String> resolveCapabilities(String name, AppProperties.Provider config, ProviderAdapter adapter) {
        if (config.capabilities().isEmpty()) {
            return adapter.capabilities().stream().sorted().toList();
        }
        List<String> resolved = new ArrayList<>();
        for (String raw : config.capabilities()) {
            String capability = Capabilities.normalize(raw);
            if (!adapter.capabilities().contains(capability)) {
                log.warn("Provider does not support configured capability provider={} capability={}", name, capability);
                continue;
            }
            if (!resolved.contains(capability)) resolved.add(capability);
        }
        return resolved;
    }

    private static RateLimitPolicy toPolicy(AppProperties.RateLimit rateLimit) {
        if (rateLimit == null) return null;
        return new RateLimitPolicy(rateLimit.capacity(), rateLimit.refillPerSecond());
    }

    private static Map<String, ProviderAdapter> index(List<ProviderAdapter> adapters) {
        Map<String, ProviderAdapter> byName = new HashMap<>();
        for (ProviderAdapter adapter : adapters) {
            if (adapter == null) {
                throw new IllegalStateException("ProviderAdapter list contains null");
            }
            String name = adapter.provider();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException(
                        "ProviderAdapter " + adapter.getClass().getName() + " returned a blank provider name"
                );
            }
            ProviderAdapter existing = byName.putIfAbsent(name, adapter);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate adapter for provider=" + name
                                + ". Existing=" + existing.getClass().getName()
                                + ", new=" + adapter.getClass().getName()
                );
            }
        }
        return Map.copyOf(byName);
    }

    public record ReloadResult(int registered, int removed, Map<String, List<String>> routing) {}
}
