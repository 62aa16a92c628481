package com.intervue.storage;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link ObjectStorageClient} for the Supabase Storage REST API.
 */
@Component
public class SupabaseObjectStorageClient implements ObjectStorageClient {

    private final RestClient.Builder restClientBuilder;
    private final StorageProperties storageProperties;

    public SupabaseObjectStorageClient(RestClient.Builder restClientBuilder, StorageProperties storageProperties) {
        this.restClientBuilder = restClientBuilder;
        this.storageProperties = storageProperties;
    }

    @Override
    public String put(byte[] bytes, String destinationPath, String contentType) {
        requireConfigured();
        String path = normalizePath(destinationPath);
        MediaType mediaType = contentType == null || contentType.isBlank()
                ? MediaType.APPLICATION_OCTET_STREAM
                : MediaType.parseMediaType(contentType);
        try {
            restClient().put()
                    .uri(URI.create(baseUrl() + "/storage/v1/object/" + bucket() + "/" + encode(path)))
                    .headers(headers -> headers.setBearerAuth(storageProperties.getServiceRoleKey()))
                    .contentType(mediaType)
                    .body(bytes == null ? new byte[0] : bytes)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw new ObjectStorageException("Upload failed for " + path, ex);
        }
        return baseUrl() + "/storage/v1/object/public/" + bucket() + "/" + path;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Accepts either a bucket-relative path or a public URL previously returned by {@link #put}.
     */
    @Override
    public String sign(String objectPath, long ttlSeconds) {
        requireConfigured();
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        String path = normalizePath(toObjectPath(objectPath));
        JsonNode body;
        try {
            body = restClient().post()
                    .uri(URI.create(baseUrl() + "/storage/v1/object/sign/" + bucket() + "/" + encode(path)))
                    .headers(headers -> headers.setBearerAuth(storageProperties.getServiceRoleKey()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("expiresIn", ttlSeconds))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new ObjectStorageException("Signing failed for " + path, ex);
        }

        String signed = signedUrl(body);
        if (signed == null) {
            throw new ObjectStorageException("Signing response for " + path + " carried no signed URL");
        }
        if (signed.startsWith("http://") || signed.startsWith("https://")) {
            return signed;
        }
        return baseUrl() + "/storage/v1" + (signed.startsWith("/") ? signed : "/" + signed);
    }

    private String toObjectPath(String reference) {
        if (reference == null) {
            return null;
        }
        String publicPrefix = baseUrl() + "/storage/v1/object/public/" + bucket() + "/";
        if (reference.startsWith(publicPrefix)) {
            return reference.substring(publicPrefix.length());
        }
        if (reference.startsWith("http://") || reference.startsWith("https://")) {
            throw new ObjectStorageException("Reference is not an object in bucket " + bucket() + ": " + reference);
        }
        return reference;
    }

    private static String signedUrl(JsonNode body) {
        if (body == null) {
            return null;
        }
        for (String field : new String[]{"signedURL", "signed_url", "signedUrl"}) {
            JsonNode value = body.get(field);
            if (value != null && value.isTextual() && !value.textValue().isBlank()) {
                return value.textValue();
            }
        }
        return null;
    }

    private RestClient restClient() {
        Duration timeout = Duration.ofSeconds(Math.max(1, storageProperties.getTimeoutSeconds()));
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return restClientBuilder.clone()
                .requestFactory(requestFactory)
                .build();
    }

    private void requireConfigured() {
        if (!storageProperties.isConfigured()) {
            throw new ObjectStorageException("Object storage is not configured (intervue.storage.url / service-role-key)");
        }
    }

    private String baseUrl() {
        String url = storageProperties.getUrl().trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private String bucket() {
        return storageProperties.getBucket();
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("object path is required");
        }
        String trimmed = path.trim();
        return trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    }

    private static String encode(String path) {
        return UriUtils.encodePath(path, StandardCharsets.UTF_8);
    }
}
