/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.redaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces the values of sensitive fields anywhere in a tree before it is logged.
 * <p>
 * Field names match case-insensitively. Subtrees deeper than {@code maxDepth} are replaced by
 * {@link #TRUNCATED} so nothing below the limit is emitted unredacted.
 */
public class TreeRedactor {
    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATED = "[TRUNCATED]";

    private static final Set<String> PROVIDER_CONTENT_FIELDS = Set.of(
            "displayName", "formattedAddress", "shortFormattedAddress", "adrFormatAddress",
            "nationalPhoneNumber", "internationalPhoneNumber", "websiteUri", "googleMapsUri",
            "regularOpeningHours", "currentOpeningHours", "reviews", "photos", "editorialSummary",
            "rating", "userRatingCount", "priceLevel", "location", "photoUri", "authorAttributions",
            "key", "apiKey", "api_key", "signature", "sig", "authorization"
    );

    private final Set<String> sensitiveFields;
    private final int maxDepth;

    public TreeRedactor(Set<String> sensitiveFields, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.sensitiveFields = sensitiveFields.stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxDepth = maxDepth;
    }

    /**
     * Redactor for provider payloads: licensed place content plus credentials.
     */
    public static TreeRedactor providerContent() {
        return new TreeRedactor(PROVIDER_CONTENT_FIELDS, 10);
    }

    public boolean isSensitive(String field) {
        return field != null && sensitiveFields.contains(field.toLowerCase(Locale.ROOT));
    }

    public JsonNode redact(JsonNode node) {
        if (node == null) return null;
        return redactNode(node, 0);
    }

    /**
     * Same walk over plain {@link Map}/{@link List} trees. The input is left untouched.
     */
    public Object redact(Object value) {
        return redactObject(value, 0);
    }

    private JsonNode redactNode(JsonNode node, int depth) {
        if (!node.isContainerNode()) return node;
        if (depth >= maxDepth) return JsonNodeFactory.instance.textNode(TRUNCATED);

        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode item : node) {
                copy.add(redactNode(item, depth + 1));
            }
            return copy;
        }

        ObjectNode copy = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isSensitive(field.getKey())) {
                copy.put(field.getKey(), REDACTED);
            } else {
                copy.set(field.getKey(), redactNode(field.getValue(), depth + 1));
            }
        }
        return copy;
    }

    private Object redactObject(Object value, int depth) {
        if (!(value instanceof Map<?, ?>) && !(value instanceof List<?>)) return value;
        if (depth >= maxDepth) return TRUNCATED;

        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(redactObject(item, depth + 1));
            }
            return copy;
        }

        Map<?, ?> map = (Map<?, ?>) value;
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            copy.put(key, isSensitive(key) ? REDACTED : redactObject(entry.getValue(), depth + 1));
        }
        return copy;
    }
}
