/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import java.util.List;

/**
 * Base for failures surfaced to dispatch callers. Carries every candidate that was skipped
 * or failed, in the order they were considered.
 */
public abstract class DispatchException extends RuntimeException {
    private final String capability;
    private final List<ProviderAttempt> attempts;

    protected DispatchException(String capability, String message, List<ProviderAttempt> attempts) {
        super(message);
        this.capability = capability;
        this.attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public String getCapability() {
        return capability;
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }
}
