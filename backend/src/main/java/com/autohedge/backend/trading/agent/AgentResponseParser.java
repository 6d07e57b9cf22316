package com.autohedge.backend.trading.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pulls the JSON object out of an agent answer. Models like to wrap JSON in prose or
 * Markdown fences, so the outermost {@code {...}} block is taken.
 */
@Component
@RequiredArgsConstructor
public class AgentResponseParser {

    private final ObjectMapper objectMapper;

    public Optional<JsonNode> parseObject(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(raw.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        String text = value.isTextual() ? value.asText() : value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    public Optional<Double> number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return finite(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return finite(Double.parseDouble(value.asText().trim().replace(",", "").replace("$", "")));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // NaN and infinities have no decimal form and count as missing.
    private static Optional<Double> finite(double value) {
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
