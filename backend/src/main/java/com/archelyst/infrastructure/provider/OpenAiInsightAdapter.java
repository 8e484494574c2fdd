/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import com.archelyst.config.AppProperties;
import com.archelyst.domain.model.Capabilities;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AI market insight through an OpenAI-compatible chat completions endpoint. Any vendor
 * exposing the same wire format can be plugged in by pointing {@code base-url} at it.
 */
@Service
public class OpenAiInsightAdapter extends HttpProviderAdapter {
    public static final String NAME = "openai";

    private static final Set<String> CAPABILITIES = Set.of(Capabilities.MARKET_INSIGHT);
    private static final String SYSTEM_PROMPT = "You are a financial markets analyst. Answer concisely, "
            + "state uncertainty explicitly and never give personalised investment advice.";

    private final AppProperties.Vendors.OpenAi properties;
    private final WebClient openAiWebClient;
    private final ObjectMapper objectMapper;

    public OpenAiInsightAdapter(
            AppProperties properties,
            @Qualifier("openAiWebClient") WebClient openAiWebClient,
            ObjectMapper objectMapper
    ) {
        this.properties = properties.vendors().openai();
        this.openAiWebClient = openAiWebClient;
        this.objectMapper = objectMapper;
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
        if (!Capabilities.MARKET_INSIGHT.equals(command.capability())) {
            throw unsupported(command.capability());
        }
        String apiKey = properties.apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw notConfigured();
        }

        Map<String, Object> body = Map.of(
                "model", properties.model(),
                "temperature", 0.2,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt(command))
                )
        );

        Mono<JsonNode> request = openAiWebClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer " + apiKey)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
        JsonNode response = call(request, command.timeout());

        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw invalid("completion without content");
        }

        ObjectNode insight = objectMapper.createObjectNode();
        insight.put("symbol", command.text("symbol"));
        insight.put("insight", content.asText().trim());
        insight.put("model", response.path("model").asText(properties.model()));
        return insight;
    }

    @Override
    public ProviderDescription describe() {
        boolean configured = properties.apiKey() != null && !properties.apiKey().isBlank();
        return new ProviderDescription(NAME, "OpenAI", CAPABILITIES, properties.baseUrl(), configured);
    }

    @Override
    protected String vendorName() {
        return "OpenAI";
    }

    static String prompt(InvokeCommand command) {
        StringBuilder sb = new StringBuilder();
        String symbol = command.text("symbol");
        String question = command.text("question");
        if (symbol != null) {
            sb.append("Instrument: ").append(symbol).append('\n');
        }
        String timeframe = command.text("timeframe");
        if (timeframe != null) {
            sb.append("Timeframe: ").append(timeframe).append('\n');
        }
        sb.append(question == null ? "Give a short market insight for this instrument." : question);
        return sb.toString();
    }
}
