package com.intervue.config;

import com.intervue.evaluation.config.JudgeProperties;
import com.intervue.evaluation.dto.HealthProbeResult;
import com.intervue.evaluation.service.HealthProbe;
import org.springframework.boot.actuate.autoconfigure.health.ConditionalOnEnabledHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exposes the judge endpoint probe as the {@code judge} actuator health component. The raw
 * excerpt is never included.
 */
@Component("judge")
@ConditionalOnEnabledHealthIndicator("judge")
public class JudgeHealthIndicator implements HealthIndicator {

    private final HealthProbe healthProbe;
    private final JudgeProperties judgeProperties;

    public JudgeHealthIndicator(HealthProbe healthProbe, JudgeProperties judgeProperties) {
        this.healthProbe = healthProbe;
        this.judgeProperties = judgeProperties;
    }

    @Override
    public Health health() {
        try {
            HealthProbeResult result = healthProbe
                    .ping(Duration.ofSeconds(judgeProperties.getHealthTimeoutSeconds()))
                    .withoutExcerpt();
            Health.Builder builder = result.ok() ? Health.up() : Health.down();
            builder.withDetail("model", judgeProperties.getModel());
            result.info().fields().forEachRemaining(field ->
                    builder.withDetail(field.getKey(), field.getValue().isValueNode()
                            ? field.getValue().asText()
                            : field.getValue().toString()));
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("model", judgeProperties.getModel())
                    .withException(e)
                    .build();
        }
    }
}
