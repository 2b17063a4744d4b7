package io.practicedb.core.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

class HttpSyncTransportTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private HttpSyncTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> respond(exchange, 200, ""));
        server.createContext("/sync/patients/changes", exchange -> respond(exchange, 200,
                "[{\"action\":\"update\",\"documentId\":\"p1\",\"data\":{\"name\":\"Remote\"},"
                        + "\"timestamp\":\"2024-03-01T08:00:00.000Z\",\"origin\":\"server\"}]"));
        server.createContext("/sync/patients", exchange -> {
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            received.add(mapper.readValue(exchange.getRequestBody(), new TypeReference<Map<String, Object>>() {
            }));
            respond(exchange, 200, "{\"ok\":true}");
        });
        server.createContext("/sync/claims", exchange -> respond(exchange, 500, "boom"));
        server.start();

        SyncConfig config = SyncConfig.builder()
                .enabled(true)
                .endpoint("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .apiKey("secret")
                .requestTimeout(Duration.ofSeconds(2))
                .build();
        transport = new HttpSyncTransport(config);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    void shouldPushChangeAsJsonWithBearerToken() {
        transport.push("patients", new SyncChange(SyncAction.CREATE, "p1", Map.of("name", "Ahmed"),
                "2024-03-01T08:00:00.000Z"));

        assertThat(authorizations).containsExactly("Bearer secret");
        assertThat(received).hasSize(1);
        assertThat(received.get(0)).containsEntry("action", "create").containsEntry("documentId", "p1");
        assertThat(received.get(0).get("data")).isEqualTo(Map.of("name", "Ahmed"));
    }

    @Test
    void shouldPullChangesIgnoringUnknownFields() {
        List<SyncChange> changes = transport.pullChanges("patients");

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).action()).isEqualTo(SyncAction.UPDATE);
        assertThat(changes.get(0).data()).containsEntry("name", "Remote");
    }

    @Test
    void shouldSurfaceHttpErrorsWithStatus() {
        SyncException e = assertThrows(SyncException.class,
                () -> transport.push("claims", new SyncChange(SyncAction.DELETE, "c1", null, null)));

        assertThat(e.getStatusCode()).isEqualTo(500);
    }

    @Test
    void shouldReportHealth() {
        assertThat(transport.checkHealth()).isTrue();
        server.stop(0);
        server = null;
        assertThat(transport.checkHealth()).isFalse();
    }
}
