/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.dispatch;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.LongAdder;

@Component
public class DispatchStatistics {
    private final LongAdder dispatches = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder failovers = new LongAdder();
    private final LongAdder exhaustions = new LongAdder();
    private final LongAdder deadlineOverruns = new LongAdder();

    void recordDispatch() {
        dispatches.increment();
    }

    void recordCacheHit() {
        cacheHits.increment();
    }

    /**
     * A dispatch answered by a provider other than the first candidate.
     */
    void recordFailover() {
        failovers.increment();
    }

    void recordExhaustion() {
        exhaustions.increment();
    }

    void recordDeadlineOverrun() {
        deadlineOverruns.increment();
    }

    public Totals snapshot() {
        long total = dispatches.sum();
        long failoverCount = failovers.sum();
        return new Totals(
                total,
                cacheHits.sum(),
                failoverCount,
                exhaustions.sum(),
                deadlineOverruns.sum(),
                total == 0 ? 0 : (double) failoverCount / total
        );
    }

    public void reset() {
        dispatches.reset();
        cacheHits.reset();
        failovers.reset();
        exhaustions.reset();
        deadlineOverruns.reset();
    }

    public record Totals(
            long dispatches,
            long cacheHits,
            long failovers,
            long exhaustions,
            long deadlineOverruns,
            double failoverRate
    ) {}
}
