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
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Generic entry point: any registered capability with free-form parameters.
 */
@RestController
@RequestMapping("/api/v1/dispatch")
public class DispatchController {
    private final FailoverDispatcher dispatcher;
    private final Clock clock;

    public DispatchController(FailoverDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @PostMapping("/{capability}")
    public DispatchResponse dispatch(
            @PathVariable("capability") String capability,
            @Valid @RequestBody(required = false) DispatchRequest req
    ) {
        String normalized = Capabilities.normalize(capability);
        Map<String, Object> params = req == null ? Map.of() : req.params();
        Duration budget = req == null || req.deadlineMs() == null ? null : Duration.ofMillis(req.deadlineMs());
        var result = dispatcher.dispatch(OperationRequest.within(normalized, params, budget, clock));
        return DispatchResponse.from(normalized, result);
    }

    public record DispatchRequest(
            Map<String, Object> params,
            @Positive @Max(300_000) Long deadlineMs
    ) {}
}
