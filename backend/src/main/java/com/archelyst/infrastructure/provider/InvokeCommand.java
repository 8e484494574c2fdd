/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record InvokeCommand(
        String capability,
        Map<String, Object> params,
        Duration timeout
) {
    public InvokeCommand {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public String text(String key) {
        Object value = params.get(key);
        if (value == null) return null;
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public String requiredText(String provider, String key) {
        String value = text(key);
        if (value == null) {
            throw new ProviderException(provider, ProviderErrorType.INVALID_RESPONSE, "Missing parameter " + key);
        }
        return value;
    }

    public String symbol(String provider) {
        return requiredText(provider, "symbol").toUpperCase(Locale.ROOT);
    }

    public int intParam(String key, int fallback) {
        Object value = params.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
