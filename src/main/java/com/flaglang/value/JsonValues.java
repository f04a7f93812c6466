package com.flaglang.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON documents into {@link Value} trees.
 * Object members holding JSON null are skipped.
 */
public final class JsonValues {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonValues() {
    }

    /**
     * Parse a JSON document.
     *
     * @param json JSON text
     * @return Converted value
     * @throws JsonProcessingException if the text is not valid JSON
     * @throws IllegalArgumentException if the document is null or holds null array elements
     */
    public static Value parse(String json) throws JsonProcessingException {
        return fromNode(objectMapper.readTree(json));
    }

    /**
     * Convert a parsed JSON node.
     */
    public static Value fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("JSON null has no value representation");
        }
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isNull()) {
                    entries.put(field.getKey(), fromNode(field.getValue()));
                }
            }
            return new Value.ObjectValue(entries);
        }
        if (node.isArray()) {
            List<Value> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromNode(element));
            }
            return new Value.ListValue(elements);
        }
        if (node.isBoolean()) {
            return Value.BooleanValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return new Value.NumberValue(node.doubleValue());
        }
        return new Value.TextValue(node.asText());
    }
}
