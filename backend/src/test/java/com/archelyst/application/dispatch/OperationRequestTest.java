/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import com.archelyst.application.cache.CacheKeys;
import com.archelyst.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OperationRequestTest {

    @Test
    void nullParameterValuesAreDropped() {
        Map<String, Object> params = new HashMap<>();
        params.put("symbol", "AAPL");
        params.put("exchange", null);

        OperationRequest request = OperationRequest.of(" Quote ", params);

        assertEquals("quote", request.capability());
        assertEquals(Map.of("symbol", "AAPL"), request.params());
        assertFalse(request.params().containsKey("exchange"));
    }

    @Test
    void explicitNullSharesCacheKeyWithAbsentParameter() {
        CacheKeys keys = new CacheKeys(new ObjectMapper());
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("symbol", "AAPL");
        withNull.put("exchange", null);

        OperationRequest a = OperationRequest.of("quote", withNull);
        OperationRequest b = OperationRequest.of("quote", Map.of("symbol", "AAPL"));

        assertEquals(keys.keyFor(b.capability(), b.params()), keys.keyFor(a.capability(), a.params()));
    }

    @Test
    void paramsAreImmutableCopies() {
        Map<String, Object> params = new HashMap<>(Map.of("symbol", "MSFT"));
        OperationRequest request = OperationRequest.of("quote", params);
        params.put("symbol", "AAPL");

        assertEquals("MSFT", request.params().get("symbol"));
        assertThrows(UnsupportedOperationException.class, () -> request.params().put("x", 1));
    }

    @Test
    void nonPositiveBudgetIsRejected() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        assertThrows(IllegalArgumentException.class,
                () -> OperationRequest.within("quote", Map.of(), Duration.ZERO, clock));
        assertEquals(clock.instant().plusMillis(250),
                OperationRequest.within("quote", Map.of(), Duration.ofMillis(250), clock).deadline());
    }
}
