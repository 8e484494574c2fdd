/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api.providers;

import com.archelyst.application.status.ProviderSnapshot;
import com.archelyst.application.status.ProviderStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/providers")
public class ProviderStatusController {
    private final ProviderStatusService providerStatusService;

    public ProviderStatusController(ProviderStatusService providerStatusService) {
        this.providerStatusService = providerStatusService;
    }

    @GetMapping
    public List<ProviderSnapshot> list() {
        return providerStatusService.snapshots();
    }

    @GetMapping("/routing")
    public Map<String, List<String>> routing() {
        return providerStatusService.routingTable();
    }
}
