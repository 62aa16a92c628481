package com.intervue.storage;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Supabase-compatible storage settings. Leaving {@code url} or {@code serviceRoleKey} empty
 * disables storage calls without failing startup.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "intervue.storage")
public class StorageProperties {

    private String url;
    private String serviceRoleKey;
    private String bucket = "submissions";
    private long signedUrlTtlSeconds = 300;
    private int timeoutSeconds = 60;

    public boolean isConfigured() {
        return url != null && !url.isBlank() && serviceRoleKey != null && !serviceRoleKey.isBlank();
    }
}
