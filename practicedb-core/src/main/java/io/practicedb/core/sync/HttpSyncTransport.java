package io.practicedb.core.sync;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON over HTTP: {@code POST {endpoint}/sync/{collection}} to push,
 * {@code GET {endpoint}/sync/{collection}/changes} to pull, {@code GET {endpoint}/health} to probe.
 */
public class HttpSyncTransport implements SyncTransport {
    private static final Logger LOGGER = Logger.getLogger(HttpSyncTransport.class.getName());

    private final SyncConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpSyncTransport(SyncConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getRequestTimeout()).build());
    }

    public HttpSyncTransport(SyncConfig config, HttpClient httpClient) {
        if (!config.hasEndpoint()) {
            throw new SyncException("Sync endpoint not configured");
        }
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public void push(String collection, SyncChange change) {
        String body;
        try {
            body = mapper.writeValueAsString(change);
        } catch (IOException e) {
            throw new SyncException("Failed to serialize change for " + change.documentId(), e);
        }
        HttpRequest request = request("/sync/" + encode(collection))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        sendRequest(request, null);
    }

    @Override
    public List<SyncChange> pullChanges(String collection) {
        HttpRequest request = request("/sync/" + encode(collection) + "/changes").GET().build();
        List<SyncChange> changes = sendRequest(request, new TypeReference<List<SyncChange>>() {
        });
        return changes == null ? new ArrayList<>() : changes;
    }

    @Override
    public boolean checkHealth() {
        HttpRequest request = request("/health").GET().build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (IOException e) {
            LOGGER.fine(() -> "Health check failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.getEndpoint() + path))
                .timeout(config.getRequestTimeout());
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getApiKey());
        }
        return builder;
    }

    private <T> T sendRequest(HttpRequest request, TypeReference<T> typeRef) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SyncException("Communication error with " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("Interrupted while calling " + request.uri(), e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new SyncException("Request failed: " + response.statusCode() + " - " + response.body(),
                    response.statusCode(), null);
        }
        if (typeRef == null || response.body() == null || response.body().isEmpty()) {
            return null;
        }
        try {
            return mapper.readValue(response.body(), typeRef);
        } catch (IOException e) {
            throw new SyncException("Unreadable response from " + request.uri(), e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
