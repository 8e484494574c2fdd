/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.Capabilities;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Financial Modeling Prep. Primary market-data vendor; needs an API key.
 */
@Service
public class FmpAdapter extends HttpProviderAdapter {
    public static final String NAME = "fmp";

    private static final Set<String> CAPABILITIES = Set.of(
            Capabilities.QUOTE,
            Capabilities.REAL_TIME,
            Capabilities.PROFILE,
            Capabilities.HISTORICAL,
            Capabilities.SEARCH,
            Capabilities.MARKET_OVERVIEW
    );
    private static final String OVERVIEW_SYMBOLS = "SPY,QQQ,DIA,BTCUSD,ETHUSD";

    private final AppProperties.Vendors.Fmp properties;
    private final WebClient fmpWebClient;

    public FmpAdapter(AppProperties properties, @Qualifier("fmpWebClient") WebClient fmpWebClient) {
        this.properties = properties.vendors().fmp();
        this.fmpWebClient = fmpWebClient;
    }

    @Override
    public String provider() {
        return NAME;
    }

    @Override
    public Set<String> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public JsonNode invoke(InvokeCommand command) {
        String apiKey = properties.apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw notConfigured();
        }

        return switch (command.capability()) {
            case Capabilities.QUOTE, Capabilities.REAL_TIME -> first(get("/quote/" + command.symbol(NAME), apiKey, command), "quote");
            case Capabilities.PROFILE -> first(get("/profile/" + command.symbol(NAME), apiKey, command), "profile");
            case Capabilities.HISTORICAL -> requireObject(historical(command, apiKey), "historical");
            case Capabilities.SEARCH -> requireArray(search(command, apiKey), "search");
            case Capabilities.MARKET_OVERVIEW -> requireArray(get("/quote/" + OVERVIEW_SYMBOLS, apiKey, command), "market overview");
            default -> throw unsupported(command.capability());
        };
    }

    @Override
    public ProviderDescription describe() {
        boolean configured = properties.apiKey() != null && !properties.apiKey().isBlank();
        return new ProviderDescription(NAME, "Financial Modeling Prep", CAPABILITIES, properties.baseUrl(), configured);
    }

    @Override
    protected String vendorName() {
        return "FMP";
    }

    private JsonNode get(String path, String apiKey, InvokeCommand command) {
        Mono<JsonNode> request = fmpWebClient.get()
                .uri(b -> b.path(path).queryParam("apikey", apiKey).build())
                .retrieve()
                .bodyToMono(JsonNode.class);
        return call(request, command.timeout());
    }

    private JsonNode historical(InvokeCommand command, String apiKey) {
        String symbol = command.symbol(NAME);
        int days = command.intParam("days", 365);
        Mono<JsonNode> request = fmpWebClient.get()
                .uri(b -> b.path("/historical-price-full/" + symbol)
                        .queryParam("timeseries", days)
                        .queryParam("apikey", apiKey)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class);
        return call(request, command.timeout());
    }

    private JsonNode search(InvokeCommand command, String apiKey) {
        String query = command.requiredText(NAME, "query");
        int limit = command.intParam("limit", 10);
        Mono<JsonNode> request = fmpWebClient.get()
                .uri(b -> b.path("/search")
                        .queryParam("query", query)
                        .queryParam("limit", limit)
                        .queryParam("apikey", apiKey)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class);
        return call(request, command.timeout());
    }

    private JsonNode first(JsonNode body, String what) {
        // FMP answers 200 with an error object or an empty list for unknown symbols
        if (body.has("Error Message")) {
            throw invalid(body.path("Error Message").asText());
        }
        if (!body.isArray() || body.isEmpty()) {
            throw invalid("empty " + what + " response");
        }
        return body.get(0);
    }

    private JsonNode requireArray(JsonNode body, String what) {
        if (!body.isArray()) {
            throw invalid("unexpected " + what + " payload");
        }
        return body;
    }

    private JsonNode requireObject(JsonNode body, String what) {
        if (!body.isObject() || body.has("Error Message") || body.isEmpty()) {
            throw invalid("unexpected " + what + " payload");
        }
        return body;
    }
}
