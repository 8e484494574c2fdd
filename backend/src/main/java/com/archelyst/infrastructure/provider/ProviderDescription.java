/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import java.util.Set;

public record ProviderDescription(
        String provider,
        String vendor,
        Set<String> capabilities,
        String baseUrl,
        boolean configured
) {}
