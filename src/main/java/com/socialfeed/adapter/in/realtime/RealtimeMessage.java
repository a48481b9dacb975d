package com.socialfeed.adapter.in.realtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A decoded realtime message: its resolved type plus the raw JSON body it arrived with.
 */
public record RealtimeMessage(RealtimeMessageType type, JsonNode body) {

    /**
     * Non-blank text value of a field.
     */
    public Optional<String> text(String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        String value = node.isTextual() ? node.textValue() : node.toString();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public Optional<JsonNode> node(String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? Optional.empty() : Optional.of(node);
    }

    /**
     * Textual elements of an array field; missing or non-array fields yield an empty list.
     */
    public List<String> textList(String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> {
            if (element.isTextual()) {
                values.add(element.textValue());
            }
        });
        return values;
    }
}
