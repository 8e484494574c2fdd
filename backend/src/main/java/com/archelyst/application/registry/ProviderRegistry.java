/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.registry;

import com.archelyst.application.dispatch.UnknownCapabilityException;
import com.archelyst.domain.model.Capabilities;
import com.archelyst.infrastructure.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Providers per capability, kept as an immutable sorted snapshot behind an atomic reference.
 * Writers build a new snapshot and swap it in; a dispatch that already read a snapshot keeps
 * iterating over it unaffected.
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private static final Comparator<Slot> ORDER = Comparator
            .comparingInt((Slot s) -> s.descriptor().priority())
            .thenComparingLong(Slot::sequence);

    private final Map<String, AtomicReference<List<Slot>>> capabilities = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void register(String capability, ProviderDescriptor descriptor) {
        String key = Capabilities.normalize(capability);
        if (!descriptor.supports(key)) {
            throw new IllegalArgumentException("Provider " + descriptor.name() + " does not declare capability " + key);
        }
        AtomicReference<List<Slot>> ref = capabilities.computeIfAbsent(key, k -> new AtomicReference<>(List.of()));
        ref.updateAndGet(current -> {
            List<Slot> next = new ArrayList<>(current.size() + 1);
            long seq = -1;
            for (Slot slot : current) {
                if (slot.descriptor().name().equals(descriptor.name())) {
                    seq = slot.sequence();
                } else {
                    next.add(slot);
                }
            }
            // a replacement keeps its registration-order slot
            next.add(new Slot(descriptor, seq >= 0 ? seq : sequence.incrementAndGet()));
            next.sort(ORDER);
            return List.copyOf(next);
        });
        log.info("Provider registered capability={} provider={} priority={}", key, descriptor.name(), descriptor.priority());
    }

    /**
     * Swaps the adapter handle of an already registered provider, keeping priority, settings and order.
     */
    public void replace(String capability, String name, ProviderAdapter adapter) {
        String key = Capabilities.normalize(capability);
        ProviderDescriptor existing = find(key, name)
                .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered for " + key));
        register(key, existing.withAdapter(adapter));
    }

    public void updatePriority(String capability, String name, int priority) {
        String key = Capabilities.normalize(capability);
        ProviderDescriptor existing = find(key, name)
                .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered for " + key));
        register(key, existing.withPriority(priority));
    }

    public boolean unregister(String capability, String name) {
        String key = Capabilities.normalize(capability);
        AtomicReference<List<Slot>> ref = capabilities.get(key);
        if (ref == null) return false;

        List<Slot> before = ref.getAndUpdate(current -> current.stream()
                .filter(slot -> !slot.descriptor().name().equals(name))
                .toList());
        boolean removed = before.stream().anyMatch(slot -> slot.descriptor().name().equals(name));
        if (removed) {
            log.info("Provider unregistered capability={} provider={}", key, name);
        }
        return removed;
    }

    /**
     * Candidates in dispatch order: ascending priority, ties by registration order.
     *
     * @throws UnknownCapabilityException when no provider is registered for the capability
     */
    public List<ProviderDescriptor> candidates(String capability) {
        String key = Capabilities.normalize(capability);
        AtomicReference<List<Slot>> ref = capabilities.get(key);
        List<Slot> snapshot = ref == null ? List.of() : ref.get();
        if (snapshot.isEmpty()) {
            throw new UnknownCapabilityException(key);
        }
        return snapshot.stream().map(Slot::descriptor).toList();
    }

    public Optional<ProviderDescriptor> find(String capability, String name) {
        AtomicReference<List<Slot>> ref = capabilities.get(Capabilities.normalize(capability));
        if (ref == null) return Optional.empty();
        return ref.get().stream()
                .map(Slot::descriptor)
                .filter(d -> d.name().equals(name))
                .findFirst();
    }

    public Set<String> capabilities() {
        Set<String> result = new TreeSet<>();
        capabilities.forEach((key, ref) -> {
            if (!ref.get().isEmpty()) result.add(key);
        });
        return result;
    }

    /**
     * Distinct providers across all capabilities, by name. When the same provider is
     * registered under several capabilities the first descriptor seen wins.
     */
    public List<ProviderDescriptor> providers() {
        Map<String, ProviderDescriptor> byName = new LinkedHashMap<>();
        for (String capability : capabilities()) {
            for (Slot slot : capabilities.get(capability).get()) {
                byName.putIfAbsent(slot.descriptor().name(), slot.descriptor());
            }
        }
        return byName.values().stream()
                .sorted(Comparator.comparing(ProviderDescriptor::name))
                .toList();
    }

    /**
     * Capability to provider names, in dispatch order.
     */
    public Map<String, List<String>> routingTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (String capability : capabilities()) {
            table.put(capability, capabilities.get(capability).get().stream()
                    .map(slot -> slot.descriptor().name())
                    .toList());
        }
        return table;
    }

    private record Slot(ProviderDescriptor descriptor, long sequence) {}
}
