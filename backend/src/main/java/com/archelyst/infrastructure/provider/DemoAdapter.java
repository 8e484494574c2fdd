/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.domain.model.Capabilities;
import com.archelyst.infrastructure.crypto.Sha256;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic synthetic data so the service is usable without vendor keys. Prices are
 * derived from a hash of the symbol, so repeated calls agree with each other.
 */
@Service
public class DemoAdapter implements ProviderAdapter {
    public static final String NAME = "demo";

    private static final Set<String> CAPABILITIES = Set.of(
            Capabilities.QUOTE,
            Capabilities.REAL_TIME,
            Capabilities.PROFILE,
            Capabilities.HISTORICAL,
            Capabilities.SEARCH,
            Capabilities.MARKET_OVERVIEW,
            Capabilities.MARKET_INSIGHT
    );
    private static final List<String> OVERVIEW_SYMBOLS = List.of("SPY", "QQQ", "DIA", "BTC-USD", "ETH-USD");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DemoAdapter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
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
            case Capabilities.QUOTE, Capabilities.REAL_TIME -> quote(command.symbol(NAME));
            case Capabilities.PROFILE -> profile(command.symbol(NAME));
            case Capabilities.HISTORICAL -> historical(command.symbol(NAME), command.intParam("days", 30));
            case Capabilities.SEARCH -> search(command.requiredText(NAME, "query"));
            case Capabilities.MARKET_OVERVIEW -> overview();
            case Capabilities.MARKET_INSIGHT -> insight(command);
            default -> throw new ProviderException(NAME, ProviderErrorType.UNAVAILABLE,
                    "Demo does not support capability " + command.capability());
        };
    }

    @Override
    public ProviderDescription describe() {
        return new ProviderDescription(NAME, "Demo", CAPABILITIES, null, true);
    }

    private ObjectNode quote(String symbol) {
        double price = basePrice(symbol);
        double change = round2(price * (seed(symbol, 7) - 0.5) / 25);
        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", symbol);
        node.put("price", price);
        node.put("change", change);
        node.put("changesPercentage", round2(change / price * 100));
        node.put("volume", (long) (seed(symbol, 11) * 10_000_000));
        node.put("timestamp", clock.instant().getEpochSecond());
        node.put("demo", true);
        return node;
    }

    private ObjectNode profile(String symbol) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", symbol);
        node.put("companyName", symbol + " Demo Holdings");
        node.put("exchange", "DEMO");
        node.put("currency", "USD");
        node.put("sector", "Technology");
        node.put("description", "Synthetic profile generated in demo mode.");
        node.put("demo", true);
        return node;
    }

    private ArrayNode historical(String symbol, int days) {
        ArrayNode rows = objectMapper.createArrayNode();
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        double price = basePrice(symbol);
        int count = Math.max(1, Math.min(days, 365));
        for (int i = count - 1; i >= 0; i--) {
            double close = round2(price * (1 + (seed(symbol, i) - 0.5) / 20));
            ObjectNode row = rows.addObject();
            row.put("date", today.minusDays(i).toString());
            row.put("close", close);
        }
        return rows;
    }

    private ArrayNode search(String query) {
        ArrayNode results = objectMapper.createArrayNode();
        String symbol = query.trim().toUpperCase(Locale.ROOT);
        ObjectNode hit = results.addObject();
        hit.put("symbol", symbol);
        hit.put("name", symbol + " Demo Holdings");
        hit.put("exchange", "DEMO");
        return results;
    }

    private ArrayNode overview() {
        ArrayNode quotes = objectMapper.createArrayNode();
        OVERVIEW_SYMBOLS.forEach(s -> quotes.add(quote(s)));
        return quotes;
    }

    private ObjectNode insight(InvokeCommand command) {
        String symbol = command.text("symbol");
        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", symbol);
        node.put("insight", symbol == null
                ? "Demo mode: markets are synthetic and move within a narrow band."
                : "Demo mode: " + symbol + " is trading near " + basePrice(symbol.toUpperCase()) + ".");
        node.put("model", "demo");
        return node;
    }

    private static double basePrice(String symbol) {
        return round2(10 + seed(symbol, 0) * 490);
    }

    private static double seed(String symbol, int salt) {
        String hex = Sha256.shortHex(symbol + ":" + salt, 8);
        return Long.parseLong(hex, 16) / (double) 0xFFFFFFFFL;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
