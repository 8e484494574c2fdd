/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api.dispatch;

import com.archelyst.application.dispatch.FailoverDispatcher;
import com.archelyst.application.dispatch.OperationRequest;
import com.archelyst.domain.model.Capabilities;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ai")
public class InsightController {
    private final FailoverDispatcher dispatcher;
    private final Clock clock;

    public InsightController(FailoverDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @PostMapping("/insight")
    public DispatchResponse insight(@Valid @RequestBody InsightRequest req) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", MarketDataController.normalizeSymbol(req.symbol()));
        if (req.timeframe() != null && !req.timeframe().isBlank()) params.put("timeframe", req.timeframe().trim());
        if (req.question() != null && !req.question().isBlank()) params.put("question", req.question().trim());

        Duration budget = req.deadlineMs() == null ? null : Duration.ofMillis(req.deadlineMs());
        var result = dispatcher.dispatch(OperationRequest.within(Capabilities.MARKET_INSIGHT, params, budget, clock));
        return DispatchResponse.from(Capabilities.MARKET_INSIGHT, result);
    }

    public record InsightRequest(
            @NotBlank @Size(max = 20) String symbol,
            @Size(max = 20) String timeframe,
            @Size(max = 500) String question,
            @Positive @Max(300_000) Long deadlineMs
    ) {}
}
