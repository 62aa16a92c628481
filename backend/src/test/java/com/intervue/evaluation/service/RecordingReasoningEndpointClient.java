package com.intervue.evaluation.service;

import com.intervue.evaluation.provider.ChatCompletionRequest;
import com.intervue.evaluation.provider.ReasoningEndpointClient;
import com.intervue.evaluation.provider.ReasoningEndpointException;
import com.intervue.evaluation.provider.ReasoningEndpointResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scripted transport that records every request it receives.
 */
class RecordingReasoningEndpointClient implements ReasoningEndpointClient {

    private final ReasoningEndpointResponse response;
    private final RuntimeException failure;
    final List<ChatCompletionRequest> requests = new ArrayList<>();
    final List<Duration> timeouts = new ArrayList<>();

    private RecordingReasoningEndpointClient(ReasoningEndpointResponse response, RuntimeException failure) {
        this.response = response;
        this.failure = failure;
    }

    static RecordingReasoningEndpointClient replying(int httpStatus, String body) {
        return new RecordingReasoningEndpointClient(new ReasoningEndpointResponse(httpStatus, body), null);
    }

    static RecordingReasoningEndpointClient failing(String message) {
        return new RecordingReasoningEndpointClient(null, new ReasoningEndpointException(message, null));
    }

    static RecordingReasoningEndpointClient throwing(RuntimeException failure) {
        return new RecordingReasoningEndpointClient(null, failure);
    }

    @Override
    public ReasoningEndpointResponse complete(ChatCompletionRequest request, Duration timeout) {
        requests.add(request);
        timeouts.add(timeout);
        if (failure != null) {
            throw failure;
        }
        return response;
    }

    int calls() {
        return requests.size();
    }
}
