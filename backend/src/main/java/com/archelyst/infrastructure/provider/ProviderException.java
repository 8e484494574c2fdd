/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.domain.model.FailureKind;

/**
 * Failure raised by a provider adapter. The message is safe to surface in API responses and
 * never carries credentials or raw upstream bodies.
 */
public class ProviderException extends RuntimeException {
    private final String provider;
    private final ProviderErrorType type;

    public ProviderException(String provider, ProviderErrorType type, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.provider = provider;
        this.type = type;
    }

    public ProviderException(String provider, ProviderErrorType type, String safeMessage) {
        this(provider, type, safeMessage, null);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public FailureKind getFailureKind() {
        return type.toFailureKind();
    }

    /** An upstream 429 says nothing about the provider's health. */
    public boolean countsAgainstHealth() {
        return type != ProviderErrorType.RATE_LIMITED;
    }

    public String getSafeMessage() {
        return getMessage();
    }
}
