/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.Capabilities;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the adapter against a local HTTP server that mimics the vendor's answers.
 */
class FmpAdapterTest {
    private ExecutorService serverExecutor;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        serverExecutor = Executors.newFixedThreadPool(2);
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(serverExecutor);
        server.createContext("/quote/AAPL", exchange -> respond(exchange, 200,
                "[{\"symbol\":\"AAPL\",\"price\":189.5}]"));
        server.createContext("/quote/NOPE", exchange -> respond(exchange, 200,
                "{\"Error Message\":\"Invalid symbol\"}"));
        server.createContext("/quote/EMPTY", exchange -> respond(exchange, 200, "[]"));
        server.createContext("/quote/BUSY", exchange -> respond(exchange, 429, "{\"message\":\"Limit Reach\"}"));
        server.createContext("/quote/DOWN", exchange -> respond(exchange, 503, "{}"));
        server.createContext("/quote/SLOW", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "[{\"symbol\":\"SLOW\"}]");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void returnsFirstQuoteAndSendsApiKey() {
        JsonNode quote = adapter("secret").invoke(quote("aapl", Duration.ofSeconds(2)));

        assertEquals("AAPL", quote.path("symbol").asText());
        assertEquals(189.5, quote.path("price").asDouble(), 1e-9);
    }

    @Test
    void mapsVendorFailuresToErrorTypes() {
        FmpAdapter adapter = adapter("secret");

        assertEquals(ProviderErrorType.INVALID_RESPONSE, failure(adapter, "NOPE"));
        assertEquals(ProviderErrorType.INVALID_RESPONSE, failure(adapter, "EMPTY"));
        assertEquals(ProviderErrorType.RATE_LIMITED, failure(adapter, "BUSY"));
        assertEquals(ProviderErrorType.UNAVAILABLE, failure(adapter, "DOWN"));
    }

    @Test
    void slowAnswerBecomesTimeout() {
        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter("secret").invoke(quote("SLOW", Duration.ofMillis(100))));
        assertEquals(ProviderErrorType.TIMEOUT, ex.getType());
        assertEquals(FmpAdapter.NAME, ex.getProvider());
    }

    @Test
    void missingApiKeyIsUnavailableAndReportedInDescription() {
        FmpAdapter adapter = adapter(" ");

        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.invoke(quote("AAPL", Duration.ofSeconds(1))));
        assertEquals(ProviderErrorType.UNAVAILABLE, ex.getType());
        assertFalse(adapter.describe().configured());
        assertTrue(adapter("secret").describe().configured());
    }

    @Test
    void rejectsCapabilitiesItDoesNotServe() {
        ProviderException ex = assertThrows(ProviderException.class, () -> adapter("secret").invoke(
                new InvokeCommand(Capabilities.MARKET_INSIGHT, Map.of("symbol", "AAPL"), Duration.ofSeconds(1))));
        assertEquals(ProviderErrorType.UNAVAILABLE, ex.getType());
    }

    private ProviderErrorType failure(FmpAdapter adapter, String symbol) {
        return assertThrows(ProviderException.class,
                () -> adapter.invoke(quote(symbol, Duration.ofSeconds(2)))).getType();
    }

    private FmpAdapter adapter(String apiKey) {
        AppProperties properties = new AppProperties(
                null,
                new AppProperties.Vendors(new AppProperties.Vendors.Fmp(apiKey, baseUrl), null, null)
        );
        return new FmpAdapter(properties, WebClient.builder().baseUrl(baseUrl).build());
    }

    private static InvokeCommand quote(String symbol, Duration timeout) {
        return new InvokeCommand(Capabilities.QUOTE, Map.of("symbol", symbol), timeout);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (!"/quote/AAPL".equals(exchange.getRequestURI().getPath())
                || "apikey=secret".equals(exchange.getRequestURI().getQuery())) {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
            return;
        }
        exchange.sendResponseHeaders(401, -1);
        exchange.close();
    }
}
