package com.tabrelay.gateway.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.tabs.TabMetadata;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.error.UnknownSessionException;
import com.tabrelay.common.model.JsonRpcMessage;
import com.tabrelay.gateway.protocol.McpProtocolTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class ClientSessionManagerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private TabRegistry registry;
    private ScheduledExecutorService scheduler;
    private ClientSessionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new TabRegistry(clock);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        manager = new ClientSessionManager(mapper, registry, scheduler, clock, 1000, 60_000);
    }

    @AfterEach
    void tearDown() {
        manager.stop();
        scheduler.shutdownNow();
    }

    private ClientSession initialized(TransportKind kind, RecordingSink sink) {
        ClientSession session = manager.create(kind, sink, null);
        session.beginInitialize(McpProtocolTypes.LATEST_VERSION, new ClientInfo("test", "1.0"));
        session.completeInitialize();
        return session;
    }

    private List<String> methods(RecordingSink sink) throws Exception {
        List<String> methods = new ArrayList<>();
        for (String json : sink.messages) {
            methods.add(mapper.readTree(json).get("method").asText());
        }
        return methods;
    }

    @Test
    void registryChanges_reachOnlyInitializedSessions() throws Exception {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        RecordingSink pending = new RecordingSink();
        initialized(TransportKind.WEBSOCKET, first);
        initialized(TransportKind.SSE, second);
        manager.create(TransportKind.HTTP, pending, null)
                .beginInitialize(McpProtocolTypes.LATEST_VERSION, null);
        manager.start();

        registry.register("t1", TabMetadata.builder().url("https://a.test").build());

        List<String> expected = List.of(McpProtocolTypes.RESOURCES_LIST_CHANGED, McpProtocolTypes.TABS_CHANGED);
        assertEquals(expected, methods(first));
        assertEquals(expected, methods(second));
        assertTrue(pending.messages.isEmpty());
    }

    @Test
    void disconnect_addsTabDisconnectedNotification() throws Exception {
        registry.register("t1", TabMetadata.builder().url("https://a.test").build());
        RecordingSink sink = new RecordingSink();
        initialized(TransportKind.WEBSOCKET, sink);
        manager.start();

        registry.remove("t1");

        assertEquals(List.of(McpProtocolTypes.RESOURCES_LIST_CHANGED, McpProtocolTypes.TAB_DISCONNECTED,
                McpProtocolTypes.TABS_CHANGED), methods(sink));
        JsonNode disconnected = mapper.readTree(sink.messages.get(1));
        assertEquals("t1", disconnected.path("params").path("tabId").asText());
        JsonNode tabs = mapper.readTree(sink.messages.get(2)).path("params").path("tabs");
        assertEquals(0, tabs.size());
    }

    @Test
    void onInitialized_sendsCurrentTabsWhenAnyConnected() throws Exception {
        RecordingSink sink = new RecordingSink();
        ClientSession session = initialized(TransportKind.WEBSOCKET, sink);

        manager.onInitialized(session);
        assertTrue(sink.messages.isEmpty());

        registry.register("t1", TabMetadata.builder().url("https://a.test").build());
        manager.onInitialized(session);
        assertEquals(List.of(McpProtocolTypes.TABS_CHANGED), methods(sink));
    }

    @Test
    void sweepIdle_expiresHttpSessionsOnly() {
        RecordingSink httpSink = new RecordingSink();
        ClientSession http = manager.create(TransportKind.HTTP, httpSink, null);
        ClientSession patient = manager.create(TransportKind.HTTP, new RecordingSink(), 5000L);
        ClientSession socket = manager.create(TransportKind.WEBSOCKET, new RecordingSink(), null);

        clock.advanceMillis(2000);

        assertEquals(1, manager.sweepIdle());
        assertTrue(manager.get(http.getId()).isEmpty());
        assertTrue(http.isClosed());
        assertTrue(httpSink.closed);
        assertTrue(manager.get(patient.getId()).isPresent());
        assertTrue(manager.get(socket.getId()).isPresent());
    }

    @Test
    void require_touchesSession() {
        ClientSession session = manager.create(TransportKind.HTTP, new RecordingSink(), null);
        clock.advanceMillis(900);

        assertSame(session, manager.require(session.getId()));
        clock.advanceMillis(900);

        assertEquals(0, manager.sweepIdle());
    }

    @Test
    void require_unknownSession_throws() {
        UnknownSessionException ex = assertThrows(UnknownSessionException.class, () -> manager.require("nope"));
        assertEquals("nope", ex.getSessionId());
        assertThrows(UnknownSessionException.class, () -> manager.require(null));
    }

    @Test
    void close_isIdempotent() {
        RecordingSink sink = new RecordingSink();
        ClientSession session = manager.create(TransportKind.SSE, sink, null);

        assertTrue(manager.close(session.getId()));
        assertFalse(manager.close(session.getId()));
        assertEquals(1, sink.closeCount);
        assertFalse(session.send("{}"));
    }

    @Test
    void broadcast_countsOnlySuccessfulDeliveries() {
        initialized(TransportKind.WEBSOCKET, new RecordingSink());
        RecordingSink broken = new RecordingSink();
        broken.failing = true;
        initialized(TransportKind.WEBSOCKET, broken);

        assertEquals(2, manager.initializedCount());
        assertEquals(1, manager.broadcast(JsonRpcMessage.Notification.create(McpProtocolTypes.CONSOLE_LOG, Map.of())));
    }

    @Test
    void onConsoleLog_forwardsEntryWithTabId() throws Exception {
        RecordingSink sink = new RecordingSink();
        initialized(TransportKind.SSE, sink);

        manager.onConsoleLog("t1", mapper.createObjectNode().put("level", "error").put("message", "boom"));

        JsonNode message = mapper.readTree(sink.messages.get(0));
        assertEquals(McpProtocolTypes.CONSOLE_LOG, message.get("method").asText());
        assertEquals("t1", message.path("params").path("tabId").asText());
        assertEquals("boom", message.path("params").path("logEntry").path("message").asText());
        assertEquals(clock.millis(), message.path("params").path("timestamp").asLong());
    }

    @Test
    void stop_closesEverySession() {
        RecordingSink a = new RecordingSink();
        RecordingSink b = new RecordingSink();
        manager.create(TransportKind.WEBSOCKET, a, null);
        manager.create(TransportKind.HTTP, b, null);

        manager.stop();

        assertEquals(0, manager.size());
        assertTrue(a.closed);
        assertTrue(b.closed);
    }

    @Test
    void describe_includesTimeoutForHttp() {
        ClientSession http = manager.create(TransportKind.HTTP, new RecordingSink(), 3000L);
        clock.advanceMillis(250);

        Map<String, Object> view = manager.describe(http);
        assertEquals("http", view.get("type"));
        assertEquals(3000L, view.get("timeoutMs"));
        assertEquals(250L, view.get("idleMs"));
        assertEquals(false, view.get("initialized"));
    }

    static final class RecordingSink implements MessageSink {
        final List<String> messages = new CopyOnWriteArrayList<>();
        volatile boolean closed;
        volatile int closeCount;
        volatile boolean failing;

        @Override
        public void send(String json) {
            if (failing) {
                throw new IllegalStateException("channel closed");
            }
            messages.add(json);
        }

        @Override
        public void close() {
            closed = true;
            closeCount++;
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advanceMillis(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
