/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import java.util.List;

public class AllProvidersExhaustedException extends DispatchException {
    public AllProvidersExhaustedException(String capability, List<ProviderAttempt> attempts) {
        super(capability, "All " + attempts.size() + " providers failed for capability " + capability, attempts);
    }
}
