/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import java.time.Instant;
import java.util.List;

public class DeadlineExceededException extends DispatchException {
    private final Instant deadline;

    public DeadlineExceededException(String capability, Instant deadline, List<ProviderAttempt> attempts) {
        super(capability, "Deadline " + deadline + " exceeded for capability " + capability, attempts);
        this.deadline = deadline;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
