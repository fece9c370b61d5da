package com.example.smartbin.ai;

import com.example.smartbin.model.BinEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON helpers shared by the HTTP-backed insight clients.
 */
final class InsightJson {

    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES = new TypeReference<>() {
    };

    private InsightJson() {
    }

    static String text(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    static Double doubleVal(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asDouble() : null;
    }

    static List<String> strings(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.has(field) || !node.get(field).isArray()) {
            return values;
        }
        for (JsonNode item : node.get(field)) {
            if (item.isValueNode()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    static List<DelegatedInsight> insights(JsonNode node, String field, boolean anomalous, ObjectMapper objectMapper) {
        List<DelegatedInsight> insights = new ArrayList<>();
        if (node == null || !node.has(field) || !node.get(field).isArray()) {
            return insights;
        }
        for (JsonNode item : node.get(field)) {
            if (!item.isObject()) {
                continue;
            }
            insights.add(new DelegatedInsight(
                    text(item, "type"),
                    text(item, "severity"),
                    doubleVal(item, "confidence"),
                    text(item, "description"),
                    text(item, "recommendation"),
                    anomalous || item.path("is_anomaly").asBoolean(false),
                    attributes(item, objectMapper)
            ));
        }
        return insights;
    }

    static Map<String, Object> attributes(JsonNode item, ObjectMapper objectMapper) {
        return objectMapper.convertValue(item, ATTRIBUTES);
    }

    static ArrayNode eventSummary(List<BinEvent> events, ObjectMapper objectMapper) {
        ArrayNode array = objectMapper.createArrayNode();
        for (BinEvent event : events) {
            array.add(eventNode(event, objectMapper));
        }
        return array;
    }

    static ObjectNode eventNode(BinEvent event, ObjectMapper objectMapper) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("eventId", event.eventId());
        node.put("binId", event.binId());
        node.put("timestamp", event.timestamp().toString());
        node.put("weight", event.weightKg());
        node.put("fillLevel", event.fillLevelPct());
        node.put("batteryLevel", event.batteryPct());
        node.put("purityScore", event.purityScore());
        node.set("categories", objectMapper.valueToTree(event.materialCounts()));
        return node;
    }
}
