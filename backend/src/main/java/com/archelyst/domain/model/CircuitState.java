/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.domain.model;

/**
 * Phase of a provider's circuit breaker. OPEN rejects calls locally; HALF_OPEN admits a
 * single trial call that decides whether the provider has recovered.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
