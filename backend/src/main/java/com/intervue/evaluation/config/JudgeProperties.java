package com.intervue.evaluation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reasoning endpoint settings for the judge and its health probe.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "intervue.judge")
public class JudgeProperties {

    private String endpoint = "https://api.perplexity.ai/chat/completions";
    private String model = "sonar-reasoning";

    /**
     * Bearer credential; leaving it empty keeps the judge in "unavailable" mode.
     */
    private String apiKey;

    private int timeoutSeconds = 60;
    private int healthTimeoutSeconds = 8;
}
