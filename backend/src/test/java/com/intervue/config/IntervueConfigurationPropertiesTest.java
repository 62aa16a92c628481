package com.intervue.config;

import com.intervue.evaluation.config.EvaluationConfig;
import com.intervue.evaluation.config.JudgeEndpointConfig;
import com.intervue.evaluation.config.JudgeProperties;
import com.intervue.storage.StorageProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervueConfigurationPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(
                    IntervueRuntimeProperties.class,
                    JudgeProperties.class,
                    StorageProperties.class,
                    EvaluationConfig.class
            );

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            IntervueRuntimeProperties runtime = context.getBean(IntervueRuntimeProperties.class);
            JudgeProperties judge = context.getBean(JudgeProperties.class);
            StorageProperties storage = context.getBean(StorageProperties.class);
            JudgeEndpointConfig endpointConfig = context.getBean(JudgeEndpointConfig.class);

            assertFalse(runtime.isDebug());
            assertEquals("sonar-reasoning", judge.getModel());
            assertEquals(60, judge.getTimeoutSeconds());
            assertEquals(8, judge.getHealthTimeoutSeconds());
            assertFalse(endpointConfig.hasCredential());
            assertEquals(Duration.ofSeconds(60), endpointConfig.timeout());

            assertEquals("submissions", storage.getBucket());
            assertEquals(300, storage.getSignedUrlTtlSeconds());
            assertFalse(storage.isConfigured());
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "intervue.debug=true",
                        "intervue.judge.endpoint=https://judge.example.test/v1/chat/completions",
                        "intervue.judge.model=sonar-pro",
                        "intervue.judge.api-key=  secret  ",
                        "intervue.judge.timeout-seconds=15",
                        "intervue.storage.url=https://project.supabase.test",
                        "intervue.storage.service-role-key=role-key",
                        "intervue.storage.bucket=answers"
                )
                .run(context -> {
                    JudgeEndpointConfig endpointConfig = context.getBean(JudgeEndpointConfig.class);
                    StorageProperties storage = context.getBean(StorageProperties.class);

                    assertTrue(context.getBean(IntervueRuntimeProperties.class).isDebug());
                    assertEquals("https://judge.example.test/v1/chat/completions",
                            endpointConfig.endpoint().toString());
                    assertEquals("sonar-pro", endpointConfig.model());
                    assertEquals("secret", endpointConfig.credential().orElseThrow());
                    assertEquals(Duration.ofSeconds(15), endpointConfig.timeout());
                    assertFalse(endpointConfig.toString().contains("secret"));
                    assertTrue(storage.isConfigured());
                    assertEquals("answers", storage.getBucket());
                });
    }

    @Test
    void nonPositiveTimeoutFailsStartup() {
        contextRunner
                .withPropertyValues("intervue.judge.timeout-seconds=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}
