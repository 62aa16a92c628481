package com.intervue.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Service-wide runtime flags.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "intervue")
public class IntervueRuntimeProperties {

    /**
     * Debugging context: when false, judge debug bags and probe excerpts never leave the service.
     */
    private boolean debug = false;
}
