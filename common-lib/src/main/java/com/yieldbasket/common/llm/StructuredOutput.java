package com.yieldbasket.common.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.exception.MalformedModelOutputException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Schema checks for model replies. Every accessor throws
 * {@link MalformedModelOutputException} rather than defaulting a missing or out-of-range field.
 */
public final class StructuredOutput {

    private StructuredOutput() {}

    /** Strips markdown fences and parses a single JSON object. */
    public static JsonNode parseObject(ObjectMapper mapper, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedModelOutputException("empty model output");
        }
        String cleaned = raw.replace("```json", "").replace("```", "").trim();
        try {
            JsonNode node = mapper.readTree(cleaned);
            if (node == null || !node.isObject()) {
                throw new MalformedModelOutputException("model output is not a JSON object");
            }
            return node;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new MalformedModelOutputException("model output is not valid JSON", e);
        }
    }

    public static <E extends Enum<E>> E requireEnum(JsonNode node, String field, Class<E> type) {
        String value = requireText(node, field).toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new MalformedModelOutputException("field '" + field + "' has unknown value '" + value + "'");
        }
    }

    public static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new MalformedModelOutputException("missing text field '" + field + "'");
        }
        return value.asText();
    }

    public static double requireUnitInterval(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MalformedModelOutputException("missing numeric field '" + field + "'");
        }
        double d = value.asDouble();
        if (Double.isNaN(d) || d < 0.0 || d > 1.0) {
            throw new MalformedModelOutputException("field '" + field + "' out of [0,1]: " + d);
        }
        return d;
    }

    public static List<String> requireTextList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new MalformedModelOutputException("missing array field '" + field + "'");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new MalformedModelOutputException("array '" + field + "' holds a non-text item");
            }
            items.add(item.asText());
        }
        return items;
    }

    /**
     * Reads a token → fraction object. Values must be within [0,1] and, when
     * {@code mustSumToOne}, add up to 1.0 within {@code tolerance}.
     */
    public static Map<String, Double> requireWeights(JsonNode node, String field, boolean mustSumToOne, double tolerance) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new MalformedModelOutputException("missing weights object '" + field + "'");
        }
        Map<String, Double> weights = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (!e.getValue().isNumber()) {
                throw new MalformedModelOutputException("weight for '" + e.getKey() + "' is not numeric");
            }
            double w = e.getValue().asDouble();
            if (w < 0.0 || w > 1.0) {
                throw new MalformedModelOutputException("weight for '" + e.getKey() + "' out of [0,1]: " + w);
            }
            if (w > 0.0) weights.put(e.getKey(), w);
        }
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (mustSumToOne && Math.abs(sum - 1.0) > tolerance) {
            throw new MalformedModelOutputException("weights '" + field + "' sum to " + sum + ", expected 1.0");
        }
        return weights;
    }
}
