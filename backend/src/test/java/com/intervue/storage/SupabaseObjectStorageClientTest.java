package com.intervue.storage;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SupabaseObjectStorageClientTest {

    private final List<String> requestLines = new ArrayList<>();
    private final List<String> authorizations = new ArrayList<>();
    private final List<byte[]> bodies = new ArrayList<>();

    private HttpServer server;
    private String baseUrl;
    private String signResponse = "{\"signedURL\": \"/object/sign/submissions/a1/report.csv?token=abc\"}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/storage/v1/object", exchange -> {
            requestLines.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getRawPath());
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            bodies.add(exchange.getRequestBody().readAllBytes());
            String path = exchange.getRequestURI().getRawPath();
            respond(exchange, 200, path.startsWith("/storage/v1/object/sign/") ? signResponse : "{\"Key\": \"ok\"}");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void putUploadsBytesAndReturnsPublicUrl() {
        SupabaseObjectStorageClient client = client(configured());
        byte[] bytes = "id,name\n1,a\n".getBytes(StandardCharsets.UTF_8);

        String url = client.put(bytes, "a1/report.csv", "text/csv");

        assertEquals(baseUrl + "/storage/v1/object/public/submissions/a1/report.csv", url);
        assertEquals("PUT /storage/v1/object/submissions/a1/report.csv", requestLines.get(0));
        assertEquals("Bearer service-key", authorizations.get(0));
        assertArrayEquals(bytes, bodies.get(0));
    }

    @Test
    void signPrefixesRelativeSignedUrl() {
        SupabaseObjectStorageClient client = client(configured());

        String signed = client.sign("a1/report.csv", 300);

        assertEquals(baseUrl + "/storage/v1/object/sign/submissions/a1/report.csv?token=abc", signed);
        assertEquals("POST /storage/v1/object/sign/submissions/a1/report.csv", requestLines.get(0));
        assertTrue(new String(bodies.get(0), StandardCharsets.UTF_8).contains("\"expiresIn\":300"));
    }

    @Test
    void signAcceptsPublicUrlOfSameBucket() {
        SupabaseObjectStorageClient client = client(configured());

        client.sign(baseUrl + "/storage/v1/object/public/submissions/a1/report.csv", 60);

        assertEquals("POST /storage/v1/object/sign/submissions/a1/report.csv", requestLines.get(0));
    }

    @Test
    void signReturnsAbsoluteSignedUrlUnchanged() {
        signResponse = "{\"signed_url\": \"https://cdn.example.test/x?token=1\"}";
        SupabaseObjectStorageClient client = client(configured());

        assertEquals("https://cdn.example.test/x?token=1", client.sign("a1/report.csv", 60));
    }

    @Test
    void signRejectsForeignUrls() {
        SupabaseObjectStorageClient client = client(configured());

        assertThrows(ObjectStorageException.class, () -> client.sign("https://elsewhere.test/file.csv", 60));
        assertTrue(requestLines.isEmpty());
    }

    @Test
    void unconfiguredStorageFailsWithoutNetwork() {
        SupabaseObjectStorageClient client = client(new StorageProperties());

        assertThrows(ObjectStorageException.class, () -> client.put(new byte[]{1}, "a/b", null));
        assertThrows(ObjectStorageException.class, () -> client.sign("a/b", 60));
        assertTrue(requestLines.isEmpty());
    }

    private StorageProperties configured() {
        StorageProperties properties = new StorageProperties();
        properties.setUrl(baseUrl + "/");
        properties.setServiceRoleKey("service-key");
        properties.setTimeoutSeconds(5);
        return properties;
    }

    private static SupabaseObjectStorageClient client(StorageProperties properties) {
        return new SupabaseObjectStorageClient(RestClient.builder(), properties);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
