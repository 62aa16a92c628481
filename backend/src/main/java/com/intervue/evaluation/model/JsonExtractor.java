package com.intervue.evaluation.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Recovers a single JSON object from free text that may wrap it in prose.
 * <p>
 * The whole text is tried first. Otherwise the last opening brace is taken as the anchor and a
 * depth-tracking scan finds its closing brace. Every earlier brace is still visited and any
 * balanced block that encloses the current match widens it, so sibling nested objects never stop
 * the scan short of their enclosing object. Failure to find an
 * object is reported as an empty result, never as an exception.
 */
public final class JsonExtractor {

    private static final ObjectMapper STRICT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonExtractor() {
    }

    public static Optional<ObjectNode> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Optional<ObjectNode> direct = parseObject(text.trim());
        if (direct.isPresent()) {
            return direct;
        }

        ObjectNode best = null;
        int bestEnd = -1;
        for (int open = text.lastIndexOf('{'); open >= 0; open = text.lastIndexOf('{', open - 1)) {
            int close = findBalancedClose(text, open);
            if (close < 0) {
                continue;
            }
            if (best != null && close < bestEnd) {
                // closes before the current match: a separate fragment or a sibling nested object
                continue;
            }
            Optional<ObjectNode> parsed = parseObject(text.substring(open, close + 1));
            if (parsed.isPresent()) {
                best = parsed.get();
                bestEnd = close;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the index of the brace closing the one at {@code open}, or -1 when the text ends
     * first. Braces inside string literals do not count.
     */
    static int findBalancedClose(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Optional<ObjectNode> parseObject(String candidate) {
        try {
            JsonNode node = STRICT_MAPPER.readTree(candidate);
            if (node instanceof ObjectNode objectNode) {
                return Optional.of(objectNode);
            }
            return Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }
}
