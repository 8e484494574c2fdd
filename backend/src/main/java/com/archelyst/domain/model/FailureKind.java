/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.domain.model;

/**
 * Why a candidate provider did not answer a dispatch. The first two are local skips,
 * the provider was never contacted.
 */
public enum FailureKind {
    RATE_LIMITED,
    CIRCUIT_OPEN,
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE;

    public boolean isLocalSkip() {
        return this == RATE_LIMITED || this == CIRCUIT_OPEN;
    }
}
