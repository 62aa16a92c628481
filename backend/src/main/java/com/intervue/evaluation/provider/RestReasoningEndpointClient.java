package com.intervue.evaluation.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intervue.evaluation.config.JudgeEndpointConfig;
import jakarta.annotation.PreDestroy;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ReasoningEndpointClient} over Spring's {@link RestClient} and the JDK HTTP client.
 * <p>
 * The timeout bounds the whole exchange, body included: the call runs on a worker thread and is
 * interrupted once the deadline passes, so an endpoint that trickles bytes cannot hold the caller.
 * An expired deadline surfaces as {@link ReasoningEndpointException}.
 */
@Component
public class RestReasoningEndpointClient implements ReasoningEndpointClient {

    private final RestClient.Builder restClientBuilder;
    private final JudgeEndpointConfig endpointConfig;
    private final ObjectMapper objectMapper;
    private final ExecutorService callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());

    public RestReasoningEndpointClient(
            RestClient.Builder restClientBuilder,
            JudgeEndpointConfig endpointConfig,
            ObjectMapper objectMapper
    ) {
        this.restClientBuilder = restClientBuilder;
        this.endpointConfig = endpointConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReasoningEndpointResponse complete(ChatCompletionRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request is required");
        Objects.requireNonNull(timeout, "timeout is required");
        String credential = endpointConfig.credential()
                .orElseThrow(() -> new IllegalStateException("Reasoning endpoint credential is not configured"));

        String requestJson = writeRequest(request);
        Future<ReasoningEndpointResponse> call = callExecutor.submit(() -> exchange(requestJson, credential, timeout));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new ReasoningEndpointException("TimeoutException: no complete reply within "
                    + timeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReasoningEndpointException("Interrupted while waiting for the reasoning endpoint", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RestClientException restClientException) {
                throw new ReasoningEndpointException(describe(restClientException), restClientException);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ReasoningEndpointException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }

    private ReasoningEndpointResponse exchange(String requestJson, String credential, Duration timeout) {
        return restClient(timeout).post()
                .uri(endpointConfig.endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> headers.setBearerAuth(credential))
                .body(requestJson)
                .exchange((clientRequest, clientResponse) -> new ReasoningEndpointResponse(
                        clientResponse.getStatusCode().value(),
                        StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)
                ));
    }

    private RestClient restClient(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        return restClientBuilder.clone()
                .requestFactory(requestFactory)
                .build();
    }

    private String writeRequest(ChatCompletionRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize chat completion request", ex);
        }
    }

    private static String describe(RestClientException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + ": " + message;
    }

    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "reasoning-endpoint-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
