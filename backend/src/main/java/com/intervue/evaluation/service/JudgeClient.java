package com.intervue.evaluation.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intervue.evaluation.config.JudgeEndpointConfig;
import com.intervue.evaluation.dto.JudgeQuestion;
import com.intervue.evaluation.dto.JudgeSubmission;
import com.intervue.evaluation.model.JsonExtractor;
import com.intervue.evaluation.model.JudgeOutcome;
import com.intervue.evaluation.model.JudgeResult;
import com.intervue.evaluation.model.JudgeResultJsonCodec;
import com.intervue.evaluation.model.RunnerResult;
import com.intervue.evaluation.model.RunnerResultJsonCodec;
import com.intervue.evaluation.provider.ChatCompletionEnvelope;
import com.intervue.evaluation.provider.ChatCompletionRequest;
import com.intervue.evaluation.provider.ReasoningEndpointClient;
import com.intervue.evaluation.provider.ReasoningEndpointException;
import com.intervue.evaluation.provider.ReasoningEndpointResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Asks the reasoning endpoint to grade one submission and normalizes its reply.
 * <p>
 * {@link #judge} never throws for runtime conditions: a missing credential, a transport failure or
 * a reply without a recoverable JSON object each produce a degraded {@link JudgeResult} with
 * score 0 and an explanatory verdict.
 */
@Service
public class JudgeClient {

    private static final Logger log = LoggerFactory.getLogger(JudgeClient.class);

    static final double TEMPERATURE = 0.0;

    static final String VERDICT_NO_CREDENTIAL = "Judge unavailable (no API key)";
    static final String VERDICT_NETWORK_ERROR = "Judge unavailable (network error)";
    static final String VERDICT_UNPARSABLE = "Judge unavailable (unparsable response)";
    static final String REASON_NO_API_KEY = "no_api_key";

    static final String SYSTEM_PROMPT = "You are a strict interview answer judge. "
            + "RETURN ONLY a single valid JSON object and nothing else. "
            + "The JSON must contain keys: score (number 0..100), verdict (string), mistakes (array), "
            + "improvements (array), citations (array). "
            + "Do not include any commentary, analysis, or text outside the JSON. "
            + "If you cannot produce values for a key, return an empty array or empty string as appropriate.";

    private final ReasoningEndpointClient reasoningEndpointClient;
    private final JudgeEndpointConfig endpointConfig;

    public JudgeClient(ReasoningEndpointClient reasoningEndpointClient, JudgeEndpointConfig endpointConfig) {
        this.reasoningEndpointClient = reasoningEndpointClient;
        this.endpointConfig = endpointConfig;
    }

    public JudgeResult judge(JudgeQuestion question, JudgeSubmission submission, RunnerResult runnerResult) {
        if (!endpointConfig.hasCredential()) {
            ObjectNode debug = JsonNodeFactory.instance.objectNode();
            debug.put("reason", REASON_NO_API_KEY);
            return JudgeResult.degraded(
                    JudgeOutcome.NO_CREDENTIAL,
                    VERDICT_NO_CREDENTIAL,
                    List.of("Judge API key not configured on server."),
                    debug
            );
        }

        ChatCompletionRequest request = ChatCompletionRequest.of(
                endpointConfig.model(),
                TEMPERATURE,
                SYSTEM_PROMPT,
                buildUserPrompt(question, submission, runnerResult)
        );

        ReasoningEndpointResponse response;
        try {
            response = reasoningEndpointClient.complete(request, endpointConfig.timeout());
        } catch (ReasoningEndpointException ex) {
            return networkFailure(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected failure calling judge endpoint", ex);
            return networkFailure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }

        if (!response.isSuccessful()) {
            return networkFailure("HTTP " + response.httpStatus() + ": "
                    + ChatCompletionEnvelope.excerpt(response.body()));
        }

        String candidateText = ChatCompletionEnvelope.candidateText(response.body());
        String rawExcerpt = ChatCompletionEnvelope.excerpt(candidateText);
        ObjectNode debug = JsonNodeFactory.instance.objectNode();
        debug.put("http_status", response.httpStatus());
        debug.put("raw_excerpt", rawExcerpt);

        Optional<ObjectNode> judgeOutput = JsonExtractor.extract(candidateText);
        if (judgeOutput.isEmpty()) {
            log.warn("Judge returned an unparsable response (http_status={})", response.httpStatus());
            return JudgeResult.degraded(
                    JudgeOutcome.UNPARSABLE_RESPONSE,
                    VERDICT_UNPARSABLE,
                    List.of("Judge returned an unparsable response."),
                    debug
            );
        }

        JudgeResult result = JudgeResultJsonCodec.fromJudgeOutput(judgeOutput.get(), debug);
        log.debug("Judge scored submission {} at {}", submission.submissionId(), result.score());
        return result;
    }

    static String buildUserPrompt(JudgeQuestion question, JudgeSubmission submission, RunnerResult runnerResult) {
        String runnerJson = runnerResult == null ? "null" : RunnerResultJsonCodec.toJson(runnerResult).toString();
        return "Question:\n" + question.toJson() + "\n\n"
                + "Submission:\n" + submission.toJson() + "\n\n"
                + "Runner checks:\n" + runnerJson + "\n\n"
                + "Return ONLY the JSON object with keys: score, verdict, mistakes, improvements, citations.";
    }

    private static JudgeResult networkFailure(String detail) {
        log.warn("Judge endpoint unreachable: {}", detail);
        ObjectNode debug = JsonNodeFactory.instance.objectNode();
        debug.put("exception", detail);
        return JudgeResult.degraded(
                JudgeOutcome.NETWORK_ERROR,
                VERDICT_NETWORK_ERROR,
                List.of("network_error: " + detail),
                debug
        );
    }
}
