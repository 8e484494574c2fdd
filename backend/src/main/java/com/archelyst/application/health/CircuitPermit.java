/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.health;

/**
 * Answer of {@link ProviderHealthService#tryAcquire(String)}. A {@code TRIAL} permit must be
 * handed back through one of the record methods, otherwise the provider stays half-open
 * with its only slot taken.
 */
public enum CircuitPermit {
    NORMAL,
    TRIAL,
    REJECTED;

    public boolean granted() {
        return this != REJECTED;
    }
}
