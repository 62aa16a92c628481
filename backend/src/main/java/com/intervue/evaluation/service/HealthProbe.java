package com.intervue.evaluation.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intervue.evaluation.config.JudgeEndpointConfig;
import com.intervue.evaluation.dto.HealthProbeResult;
import com.intervue.evaluation.provider.ChatCompletionEnvelope;
import com.intervue.evaluation.provider.ChatCompletionRequest;
import com.intervue.evaluation.provider.ReasoningEndpointClient;
import com.intervue.evaluation.provider.ReasoningEndpointException;
import com.intervue.evaluation.provider.ReasoningEndpointResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * Cheap reachability check against the judge's reasoning endpoint.
 * <p>
 * Success means a 2xx reply whose body is well-formed JSON; the reply is not validated against
 * the judge schema.
 */
@Service
public class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    static final String SYSTEM_PROMPT =
            "You are a diagnostic helper. Reply quickly with the single JSON: {\"ok\": true} (no extra text).";
    static final String USER_PROMPT = "health-check";
    static final int MAX_TOKENS = 8;

    private final ReasoningEndpointClient reasoningEndpointClient;
    private final JudgeEndpointConfig endpointConfig;

    public HealthProbe(ReasoningEndpointClient reasoningEndpointClient, JudgeEndpointConfig endpointConfig) {
        this.reasoningEndpointClient = reasoningEndpointClient;
        this.endpointConfig = endpointConfig;
    }

    public HealthProbeResult ping(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout is required");
        ObjectNode info = JsonNodeFactory.instance.objectNode();
        if (!endpointConfig.hasCredential()) {
            info.put("error", JudgeClient.REASON_NO_API_KEY);
            return new HealthProbeResult(false, info);
        }

        ChatCompletionRequest request = ChatCompletionRequest
                .of(endpointConfig.model(), JudgeClient.TEMPERATURE, SYSTEM_PROMPT, USER_PROMPT)
                .withMaxTokens(MAX_TOKENS);

        long startedAt = System.nanoTime();
        try {
            ReasoningEndpointResponse response = reasoningEndpointClient.complete(request, timeout);
            boolean parsed = ChatCompletionEnvelope.isJson(response.body());
            boolean ok = response.isSuccessful() && parsed;
            info.put("http_status", response.httpStatus());
            info.put("time_ms", elapsedMillis(startedAt));
            info.put("parsed", parsed);
            info.put(HealthProbeResult.INFO_RAW_EXCERPT, ChatCompletionEnvelope.excerpt(response.body()));
            if (!ok) {
                log.warn("Judge health probe failed (http_status={}, parsed={})", response.httpStatus(), parsed);
            }
            return new HealthProbeResult(ok, info);
        } catch (ReasoningEndpointException ex) {
            info.put("exception", ex.getMessage());
            info.put("time_ms", elapsedMillis(startedAt));
            log.warn("Judge health probe could not reach endpoint: {}", ex.getMessage());
            return new HealthProbeResult(false, info);
        } catch (RuntimeException ex) {
            info.put("exception", ex.getClass().getSimpleName() + ": " + ex.getMessage());
            info.put("time_ms", elapsedMillis(startedAt));
            log.error("Unexpected failure during judge health probe", ex);
            return new HealthProbeResult(false, info);
        }
    }

    private static long elapsedMillis(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
    }
}
