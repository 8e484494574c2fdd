/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.config;

import com.archelyst.application.registry.ProviderRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestrationConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRegistry providerRegistry() {
        return new ProviderRegistry();
    }

    /**
     * Runs provider invocations so the dispatcher can stop waiting on a slow one. The queue is
     * bounded; a saturated pool makes the candidate count as unavailable.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(AppProperties properties) {
        int threads = properties.orchestration().dispatchThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 16),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
