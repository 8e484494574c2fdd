/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api.dispatch;

import com.archelyst.api.ApiException;
import com.archelyst.application.dispatch.FailoverDispatcher;
import com.archelyst.application.dispatch.OperationRequest;
import com.archelyst.domain.model.Capabilities;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/v1/market")
public class MarketDataController {
    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9.^=-]{1,20}$");

    private final FailoverDispatcher dispatcher;

    public MarketDataController(FailoverDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/quote/{symbol}")
    public DispatchResponse quote(
            @PathVariable("symbol") String symbol,
            @RequestParam(value = "realTime", defaultValue = "false") boolean realTime
    ) {
        String capability = realTime ? Capabilities.REAL_TIME : Capabilities.QUOTE;
        return dispatch(capability, Map.of("symbol", normalizeSymbol(symbol)));
    }

    @GetMapping("/profile/{symbol}")
    public DispatchResponse profile(@PathVariable("symbol") String symbol) {
        return dispatch(Capabilities.PROFILE, Map.of("symbol", normalizeSymbol(symbol)));
    }

    @GetMapping("/historical/{symbol}")
    public DispatchResponse historical(
            @PathVariable("symbol") String symbol,
            @RequestParam(value = "days", defaultValue = "30") int days
    ) {
        if (days < 1 || days > 3650) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "days must be between 1 and 3650");
        }
        return dispatch(Capabilities.HISTORICAL, Map.of("symbol", normalizeSymbol(symbol), "days", days));
    }

    @GetMapping("/search")
    public DispatchResponse search(@RequestParam("query") String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty() || trimmed.length() > 100) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "query must be between 1 and 100 characters");
        }
        return dispatch(Capabilities.SEARCH, Map.of("query", trimmed));
    }

    @GetMapping("/overview")
    public DispatchResponse overview() {
        return dispatch(Capabilities.MARKET_OVERVIEW, Map.of());
    }

    static String normalizeSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(normalized).matches()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "Invalid symbol");
        }
        return normalized;
    }

    private DispatchResponse dispatch(String capability, Map<String, Object> params) {
        return DispatchResponse.from(capability, dispatcher.dispatch(OperationRequest.of(capability, params)));
    }
}
