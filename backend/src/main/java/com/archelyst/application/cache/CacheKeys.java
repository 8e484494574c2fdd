/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.application.cache;

import com.archelyst.domain.model.Capabilities;
import com.archelyst.infrastructure.crypto.Sha256;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache keys are {@code capability:sha256(canonical params)}. Canonical form is compact JSON
 * with object keys sorted at every depth, so parameter order never changes the key.
 */
@Component
public class CacheKeys {
    private final ObjectMapper objectMapper;

    public CacheKeys(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String keyFor(String capability, Map<String, Object> params) {
        return prefix(capability) + Sha256.hex(canonicalJson(params));
    }

    public static String prefix(String capability) {
        return Capabilities.normalize(capability) + ":";
    }

    String canonicalJson(Map<String, Object> params) {
        JsonNode tree = objectMapper.valueToTree(params == null ? Map.of() : params);
        try {
            return objectMapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("params are not serializable", e);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), canonicalize(field.getValue()));
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> result.add(canonicalize(element)));
            return result;
        }
        return node;
    }
}
