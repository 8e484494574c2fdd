/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.domain.model;

import java.util.Locale;

/**
 * Well-known capability names. Capabilities are plain strings so configuration can
 * introduce new ones without a code change.
 */
public final class Capabilities {
    public static final String QUOTE = "quote";
    public static final String REAL_TIME = "real-time";
    public static final String PROFILE = "profile";
    public static final String HISTORICAL = "historical";
    public static final String SEARCH = "search";
    public static final String MARKET_OVERVIEW = "market-overview";
    public static final String MARKET_INSIGHT = "market-insight";

    private Capabilities() {}

    public static String normalize(String capability) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability is required");
        }
        return capability.trim().toLowerCase(Locale.ROOT);
    }
}
