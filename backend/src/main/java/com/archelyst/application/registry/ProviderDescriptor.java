/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.registry;

import com.archelyst.infrastructure.provider.ProviderAdapter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a registered provider. Hot swap replaces the whole descriptor;
 * it is never mutated in place.
 */
public record ProviderDescriptor(
        String name,
        List<String> capabilities,
        int priority,
        ProviderSettings settings,
        ProviderAdapter adapter
) {
    public ProviderDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name is required");
        }
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(adapter, "adapter");
        capabilities = capabilities == null ? List.of() : List.copyOf(new LinkedHashSet<>(capabilities));
    }

    public static ProviderDescriptor of(ProviderAdapter adapter, int priority, ProviderSettings settings) {
        return new ProviderDescriptor(adapter.provider(), List.copyOf(adapter.capabilities()), priority, settings, adapter);
    }

    public boolean supports(String capability) {
        return capabilities.isEmpty() || capabilities.contains(capability);
    }

    public ProviderDescriptor withPriority(int newPriority) {
        return new ProviderDescriptor(name, capabilities, newPriority, settings, adapter);
    }

    public ProviderDescriptor withAdapter(ProviderAdapter newAdapter) {
        return new ProviderDescriptor(name, capabilities, priority, settings, newAdapter);
    }
}
