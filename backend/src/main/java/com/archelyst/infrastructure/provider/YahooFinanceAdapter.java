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

import java.util.Map;
import java.util.Set;

/**
 * Yahoo Finance public endpoints. Keyless, so it is the usual fallback behind FMP.
 */
@Service
public class YahooFinanceAdapter extends HttpProviderAdapter {
    public static final String NAME = "yahoo-finance";

    private static final Set<String> CAPABILITIES = Set.of(
            Capabilities.QUOTE,
            Capabilities.REAL_TIME,
            Capabilities.PROFILE,
            Capabilities.HISTORICAL,
            Capabilities.SEARCH,
            Capabilities.MARKET_OVERVIEW
    );

    private static final Map<String, String> CRYPTO_SYMBOLS = Map.of(
            "BTC", "BTC-USD",
            "ETH", "ETH-USD",
            "ADA", "ADA-USD",
            "DOT", "DOT-USD",
            "LTC", "LTC-USD",
            "XRP", "XRP-USD",
            "DOGE", "DOGE-USD",
            "SOL", "SOL-USD",
            "MATIC", "MATIC-USD",
            "AVAX", "AVAX-USD"
    );
    private static final String OVERVIEW_SYMBOLS = "^GSPC,^IXIC,^DJI,BTC-USD,ETH-USD";

    private final AppProperties.Vendors.Yahoo properties;
    private final WebClient yahooWebClient;

    public YahooFinanceAdapter(AppProperties properties, @Qualifier("yahooWebClient") WebClient yahooWebClient) {
        this.properties = properties.vendors().yahoo();
        this.yahooWebClient = yahooWebClient;
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
        return switch (command.capability()) {
            case Capabilities.QUOTE, Capabilities.REAL_TIME -> firstResult(quotes(toYahooSymbol(command.symbol(NAME)), command));
            case Capabilities.PROFILE -> profile(toYahooSymbol(command.symbol(NAME)), command);
            case Capabilities.HISTORICAL -> chart(toYahooSymbol(command.symbol(NAME)), command);
            case Capabilities.SEARCH -> search(command);
            case Capabilities.MARKET_OVERVIEW -> quotes(OVERVIEW_SYMBOLS, command);
            default -> throw unsupported(command.capability());
        };
    }

    @Override
    public ProviderDescription describe() {
        return new ProviderDescription(NAME, "Yahoo Finance", CAPABILITIES, properties.baseUrl(), true);
    }

    @Override
    protected String vendorName() {
        return "Yahoo Finance";
    }

    static String toYahooSymbol(String symbol) {
        return CRYPTO_SYMBOLS.getOrDefault(symbol, symbol);
    }

    /**
     * Smallest chart range that covers the requested number of days.
     */
    static String rangeForDays(int days) {
        if (days <= 1) return "1d";
        if (days <= 5) return "5d";
        if (days <= 31) return "1mo";
        if (days <= 92) return "3mo";
        if (days <= 183) return "6mo";
        if (days <= 366) return "1y";
        if (days <= 731) return "2y";
        if (days <= 1827) return "5y";
        return "10y";
    }

    private JsonNode quotes(String symbols, InvokeCommand command) {
        JsonNode body = get(yahooWebClient.get()
                .uri(b -> b.path("/v7/finance/quote").queryParam("symbols", symbols).build()), command);
        JsonNode result = body.path("quoteResponse").path("result");
        if (!result.isArray()) {
            throw invalid("quoteResponse.result missing");
        }
        return result;
    }

    private JsonNode profile(String symbol, InvokeCommand command) {
        JsonNode body = get(yahooWebClient.get()
                .uri(b -> b.path("/v10/finance/quoteSummary/{symbol}")
                        .queryParam("modules", "assetProfile,price")
                        .build(symbol)), command);
        JsonNode result = firstResult(body.path("quoteSummary").path("result"));
        if (!result.has("assetProfile")) {
            throw invalid("assetProfile missing for " + symbol);
        }
        return result;
    }

    private JsonNode chart(String symbol, InvokeCommand command) {
        String range = command.text("period") != null ? command.text("period") : rangeForDays(command.intParam("days", 365));
        String interval = command.text("interval") == null ? "1d" : command.text("interval");
        JsonNode body = get(yahooWebClient.get()
                .uri(b -> b.path("/v8/finance/chart/{symbol}")
                        .queryParam("range", range)
                        .queryParam("interval", interval)
                        .build(symbol)), command);
        return firstResult(body.path("chart").path("result"));
    }

    private JsonNode search(InvokeCommand command) {
        String query = command.requiredText(NAME, "query");
        int limit = command.intParam("limit", 10);
        JsonNode body = get(yahooWebClient.get()
                .uri(b -> b.path("/v1/finance/search")
                        .queryParam("q", query)
                        .queryParam("quotesCount", limit)
                        .queryParam("newsCount", 0)
                        .build()), command);
        JsonNode quotes = body.path("quotes");
        if (!quotes.isArray()) {
            throw invalid("search quotes missing");
        }
        return quotes;
    }

    private JsonNode get(WebClient.RequestHeadersSpec<?> spec, InvokeCommand command) {
        Mono<JsonNode> request = spec.retrieve().bodyToMono(JsonNode.class);
        return call(request, command.timeout());
    }

    private JsonNode firstResult(JsonNode result) {
        if (!result.isArray() || result.isEmpty()) {
            throw invalid("no result");
        }
        return result.get(0);
    }
}
