package com.intervue.evaluation.provider;

import java.time.Duration;

/**
 * Transport abstraction for the chat-completion reasoning endpoint.
 */
public interface ReasoningEndpointClient {

    /**
     * Posts one chat-completion request and returns the response for any HTTP status.
     *
     * @throws ReasoningEndpointException when no HTTP response arrives within {@code timeout}
     */
    ReasoningEndpointResponse complete(ChatCompletionRequest request, Duration timeout);
}
