package com.intervue.evaluation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EvaluationConfig {

    private static final Logger log = LoggerFactory.getLogger(EvaluationConfig.class);

    @Bean
    public JudgeEndpointConfig judgeEndpointConfig(JudgeProperties judgeProperties) {
        JudgeEndpointConfig config = JudgeEndpointConfig.from(judgeProperties);
        if (config.hasCredential()) {
            log.info("Judge endpoint configured: {}", config);
        } else {
            log.warn("No judge API key configured; submissions will be graded as unavailable ({})", config);
        }
        return config;
    }
}
