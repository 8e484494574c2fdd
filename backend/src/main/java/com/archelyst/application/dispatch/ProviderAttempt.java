/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.archelyst.domain.model.FailureKind;

public record ProviderAttempt(
        String provider,
        FailureKind kind,
        String message,
        long elapsedMs
) {
    public static ProviderAttempt skipped(String provider, FailureKind kind, String message) {
        return new ProviderAttempt(provider, kind, message, 0);
    }
}
