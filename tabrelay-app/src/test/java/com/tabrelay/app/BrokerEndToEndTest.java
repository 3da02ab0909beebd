package com.tabrelay.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole broker on a free port and drives it the way a tab agent and a
 * protocol client would.
 */
@SpringBootTest
class BrokerEndToEndTest {

    @TempDir
    static Path configDir;

    private static final int PORT = freePort();

    @DynamicPropertySource
    static void brokerProperties(DynamicPropertyRegistry registry) {
        registry.add("tabrelay.config.path", () -> configDir.resolve("config.json").toString());
        registry.add("tabrelay.port", () -> PORT);
    }

    @Autowired
    private BrokerLifecycle lifecycle;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private WebSocket agent;

    @AfterEach
    void disconnectAgent() {
        if (agent != null) {
            agent.abort();
        }
    }

    private static int freePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private String base() {
        return "http://localhost:" + lifecycle.getPort();
    }

    private HttpResponse<String> post(String path, String body, String sessionId) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(base() + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (sessionId != null) {
            request.header("Mcp-Session-Id", sessionId);
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(base() + path)).timeout(Duration.ofSeconds(10)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_reportsRunningBroker() throws Exception {
        assertEquals(PORT, lifecycle.getPort());

        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("ok", mapper.readTree(response.body()).get("status").asText());
    }

    @Test
    void toolCall_travelsToTabAgentAndBack() throws Exception {
        agent = http.newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + lifecycle.getPort() + "/"), new EchoAgent())
                .get(5, TimeUnit.SECONDS);
        agent.sendText("{\"type\":\"register\",\"tabId\":\"e2e-1\",\"url\":\"https://example.com\","
                + "\"title\":\"Example\",\"active\":true}", true).get(5, TimeUnit.SECONDS);
        awaitTab("e2e-1");

        HttpResponse<String> init = post("/mcp",
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":\"2025-06-18\"}}",
                null);
        assertEquals(200, init.statusCode());
        String sessionId = init.headers().firstValue("Mcp-Session-Id").orElseThrow();

        assertEquals(202, post("/mcp", "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}", sessionId)
                .statusCode());

        HttpResponse<String> call = post("/mcp", """
                {"jsonrpc":"2.0","id":2,"method":"tools/call",
                 "params":{"name":"navigate","arguments":{"tabId":"e2e-1","url":"https://example.org"}}}
                """, sessionId);

        assertEquals(200, call.statusCode());
        JsonNode result = mapper.readTree(call.body()).get("result");
        assertFalse(result.has("isError"), call.body());
        JsonNode echoed = mapper.readTree(result.get("content").get(0).get("text").asText());
        assertEquals("navigate", echoed.get("command").asText());
        assertEquals("https://example.org", echoed.path("params").path("url").asText());
        assertFalse(echoed.path("params").has("tabId"));
    }

    private void awaitTab(String tabId) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode tabs = mapper.readTree(get("/tabs").body()).get("tabs");
            for (JsonNode tab : tabs) {
                if (tabId.equals(tab.get("tabId").asText())) {
                    return;
                }
            }
            Thread.sleep(50);
        }
        fail("tab " + tabId + " never registered");
    }

    /**
     * Answers every command with the command it received.
     */
    private final class EchoAgent implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                reply(webSocket, text);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        private void reply(WebSocket webSocket, String text) {
            try {
                JsonNode message = mapper.readTree(text);
                if (!"command".equals(message.path("type").asText())) {
                    return;
                }
                ObjectNode result = mapper.createObjectNode();
                result.put("command", message.get("command").asText());
                result.set("params", message.get("params"));
                ObjectNode response = mapper.createObjectNode();
                response.put("type", "response");
                response.put("id", message.get("id").asText());
                response.put("success", true);
                response.set("result", result);
                webSocket.sendText(mapper.writeValueAsString(response), true);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
