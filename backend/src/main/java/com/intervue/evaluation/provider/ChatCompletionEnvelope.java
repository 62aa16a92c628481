package com.intervue.evaluation.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Reads the model text out of a chat-completion response body
 * ({@code choices[0].message.content}, falling back to {@code .text}).
 */
public final class ChatCompletionEnvelope {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int EXCERPT_LIMIT = 400;

    private ChatCompletionEnvelope() {
    }

    /**
     * Returns the model's textual output. A JSON body without message content yields the body JSON
     * itself; a non-JSON body is returned verbatim.
     */
    public static String candidateText(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        Optional<JsonNode> parsed = parse(body);
        if (parsed.isEmpty()) {
            return body;
        }
        JsonNode root = parsed.get();
        JsonNode message = root.path("choices").path(0).path("message");
        for (String field : new String[]{"content", "text"}) {
            JsonNode content = message.get(field);
            if (content != null && content.isTextual() && !content.textValue().isEmpty()) {
                return content.textValue();
            }
        }
        return root.toString();
    }

    /**
     * Returns true when the whole body is well-formed JSON.
     */
    public static boolean isJson(String body) {
        return body != null && !body.isBlank() && parse(body).isPresent();
    }

    public static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= EXCERPT_LIMIT) {
            return text;
        }
        return text.substring(0, EXCERPT_LIMIT) + "...";
    }

    private static Optional<JsonNode> parse(String body) {
        try {
            JsonNode node = MAPPER.readTree(body);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }
}
