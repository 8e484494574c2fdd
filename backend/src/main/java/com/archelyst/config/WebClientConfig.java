/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One client per vendor. Netty timeouts are a backstop; each call is also bounded by the
 * timeout the dispatcher hands to the adapter.
 */
@Configuration
public class WebClientConfig {
    private static final int CONNECT_TIMEOUT_MS = 5_000;
    private static final int IO_TIMEOUT_SECONDS = 30;

    @Bean
    public WebClient fmpWebClient(AppProperties properties) {
        return build(properties.vendors().fmp().baseUrl(), 2 * 1024 * 1024);
    }

    @Bean
    public WebClient yahooWebClient(AppProperties properties) {
        return build(properties.vendors().yahoo().baseUrl(), 2 * 1024 * 1024);
    }

    @Bean
    public WebClient openAiWebClient(AppProperties properties) {
        return build(properties.vendors().openai().baseUrl(), 512 * 1024);
    }

    private static WebClient build(String baseUrl, int maxInMemorySize) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofSeconds(IO_TIMEOUT_SECONDS))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(IO_TIMEOUT_SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(IO_TIMEOUT_SECONDS)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(maxInMemorySize))
                        .build())
                .build();
    }
}
