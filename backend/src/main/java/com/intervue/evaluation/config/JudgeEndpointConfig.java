package com.intervue.evaluation.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for the reasoning endpoint shared by the judge and the health probe.
 * A missing credential is a valid state meaning "judge unavailable", not a misconfiguration.
 */
public record JudgeEndpointConfig(
        URI endpoint,
        String model,
        Optional<String> credential,
        Duration timeout
) {
    public JudgeEndpointConfig {
        Objects.requireNonNull(endpoint, "endpoint is required");
        if (!endpoint.isAbsolute()) {
            throw new IllegalArgumentException("endpoint must be an absolute URI: " + endpoint);
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        model = model.trim();
        credential = credential == null
                ? Optional.empty()
                : credential.map(String::trim).filter(value -> !value.isEmpty());
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static JudgeEndpointConfig from(JudgeProperties properties) {
        if (properties.getEndpoint() == null || properties.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("intervue.judge.endpoint must not be blank");
        }
        return new JudgeEndpointConfig(
                URI.create(properties.getEndpoint().trim()),
                properties.getModel(),
                Optional.ofNullable(properties.getApiKey()),
                Duration.ofSeconds(properties.getTimeoutSeconds())
        );
    }

    public boolean hasCredential() {
        return credential.isPresent();
    }

    @Override
    public String toString() {
        return "JudgeEndpointConfig[endpoint=" + endpoint
                + ", model=" + model
                + ", credential=" + (credential.isPresent() ? "<set>" : "<absent>")
                + ", timeout=" + timeout + "]";
    }
}
