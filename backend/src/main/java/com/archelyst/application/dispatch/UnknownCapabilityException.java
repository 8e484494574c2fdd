/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import java.util.List;

public class UnknownCapabilityException extends DispatchException {
    public UnknownCapabilityException(String capability) {
        super(capability, "No provider registered for capability " + capability, List.of());
    }
}
