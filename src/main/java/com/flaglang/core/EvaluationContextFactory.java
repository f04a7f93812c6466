package com.flaglang.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.value.JsonValues;
import com.flaglang.value.Value;

import java.util.Iterator;
import java.util.Map;

/**
 * Factory for creating EvaluationContext from a JSON payload.
 * Nested JSON objects become object values (not flattened), arrays become lists and
 * members holding JSON null are skipped.
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EvaluationContextFactory() {
    }

    /**
     * Create an EvaluationContext from a JSON object payload.
     *
     * @param jsonPayload JSON object text; null or blank gives an empty context
     * @return Context with one variable per top-level member
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public static EvaluationContext fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return EvaluationContext.empty();
        }

        JsonNode root = parseJson(jsonPayload);
        if (!root.isObject()) {
            throw new IllegalArgumentException("JSON payload must be an object, got " + root.getNodeType());
        }

        EvaluationContext.Builder builder = EvaluationContext.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                continue;
            }
            Value value = JsonValues.fromNode(field.getValue());
            builder.variable(field.getKey(), value);
        }
        return builder.build();
    }

    /**
     * Create an EvaluationContext from a JSON payload plus extra string variables
     * (e.g., headers). Extra variables override payload members with the same name.
     */
    public static EvaluationContext fromJson(String jsonPayload, Map<String, String> extra) {
        EvaluationContext payload = fromJson(jsonPayload);
        if (extra == null || extra.isEmpty()) {
            return payload;
        }
        return EvaluationContext.builder()
                .variables(payload.getVariables())
                .variables(extra)
                .build();
    }

    private static JsonNode parseJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }
}
