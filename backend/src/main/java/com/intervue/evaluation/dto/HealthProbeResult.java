package com.intervue.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Liveness verdict for the reasoning endpoint plus diagnostic info
 * ({@code http_status}, {@code time_ms}, {@code parsed}, {@code raw_excerpt}, {@code exception},
 * {@code error}).
 */
public record HealthProbeResult(
        @JsonProperty("ok")
        boolean ok,
        @JsonProperty("info")
        ObjectNode info
) {
    public static final String INFO_RAW_EXCERPT = "raw_excerpt";

    public HealthProbeResult {
        info = info == null ? JsonNodeFactory.instance.objectNode() : info.deepCopy();
    }

    public HealthProbeResult withoutExcerpt() {
        if (!info.has(INFO_RAW_EXCERPT)) {
            return this;
        }
        ObjectNode redacted = info.deepCopy();
        redacted.remove(INFO_RAW_EXCERPT);
        return new HealthProbeResult(ok, redacted);
    }
}
