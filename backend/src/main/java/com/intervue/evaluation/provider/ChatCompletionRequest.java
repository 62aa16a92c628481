package com.intervue.evaluation.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Chat-completion request body sent to the reasoning endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionRequest(
        @JsonProperty("model")
        String model,
        @JsonProperty("temperature")
        double temperature,
        @JsonProperty("messages")
        List<Message> messages,
        @JsonProperty("max_tokens")
        Integer maxTokens
) {
    public ChatCompletionRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ChatCompletionRequest of(String model, double temperature, String system, String user) {
        return new ChatCompletionRequest(
                model,
                temperature,
                List.of(Message.system(system), Message.user(user)),
                null
        );
    }

    public ChatCompletionRequest withMaxTokens(int tokens) {
        return new ChatCompletionRequest(model, temperature, messages, tokens);
    }

    public record Message(
            @JsonProperty("role")
            String role,
            @JsonProperty("content")
            String content
    ) {
        public Message {
            Objects.requireNonNull(role, "role is required");
            content = content == null ? "" : content;
        }

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }
}
