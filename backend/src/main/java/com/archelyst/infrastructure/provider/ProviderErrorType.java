/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.domain.model.FailureKind;

public enum ProviderErrorType {
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE,
    RATE_LIMITED;

    public FailureKind toFailureKind() {
        return switch (this) {
            case TIMEOUT -> FailureKind.TIMEOUT;
            case UNAVAILABLE -> FailureKind.UNAVAILABLE;
            case INVALID_RESPONSE -> FailureKind.INVALID_RESPONSE;
            case RATE_LIMITED -> FailureKind.RATE_LIMITED;
        };
    }

    /**
     * Maps an upstream HTTP status to the error kind the orchestration layer understands.
     */
    public static ProviderErrorType fromHttpStatus(int status) {
        if (status == 429) return RATE_LIMITED;
        if (status == 408 || status == 504) return TIMEOUT;
        if (status >= 500) return UNAVAILABLE;
        if (status == 401 || status == 403) return UNAVAILABLE;
        return INVALID_RESPONSE;
    }
}
