/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api;

import com.archelyst.application.dispatch.ProviderAttempt;

import java.util.List;

public record ApiErrorResponse(
        String status,
        String code,
        String message,
        String requestId,
        List<ProviderAttempt> attempts
) {}
