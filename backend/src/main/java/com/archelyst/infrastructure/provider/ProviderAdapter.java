/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Vendor-specific client wrapped by the orchestration layer. Implementations must throw
 * {@link ProviderException} for every upstream failure so the dispatcher can tell
 * throttling, timeouts and broken payloads apart.
 */
public interface ProviderAdapter {
    String provider();

    Set<String> capabilities();

    JsonNode invoke(InvokeCommand command);

    ProviderDescription describe();
}
