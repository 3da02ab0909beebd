package com.tabrelay.browser.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.browser.tabs.TabMetadata;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.CommandTimeoutException;
import com.tabrelay.common.error.TabCommandException;
import com.tabrelay.common.error.TabNotConnectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CommandCorrelatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ScheduledExecutorService scheduler;
    private TabRegistry registry;
    private FakeSender sender;
    private CommandCorrelator correlator;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        registry = new TabRegistry();
        sender = new FakeSender();
        correlator = new CommandCorrelator(sender, registry, scheduler);
        registry.register("t1", TabMetadata.builder().url("https://a.test").build());
        sender.connected.add("t1");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void successfulResponse_updatesRegistryUrl() throws Exception {
        ObjectNode params = mapper.createObjectNode().put("url", "https://b.test").put("timeout", 1000).put("wait", true);
        CompletableFuture<JsonNode> future = correlator.execute("t1", "navigate", params, 5000);

        TabRelayTypes.CommandMessage sent = sender.sent.get(0);
        assertEquals("command", sent.getType());
        assertEquals("navigate", sent.getCommand());
        assertTrue(sent.getId().startsWith("cmd-"));

        ObjectNode result = mapper.createObjectNode().put("url", "https://b.test").put("title", "B");
        assertTrue(correlator.handleResponse(TabRelayTypes.ResponseMessage.ok(sent.getId(), result)));

        assertEquals("https://b.test", future.get(1, TimeUnit.SECONDS).get("url").asText());
        assertEquals("https://b.test", registry.get("t1").orElseThrow().url());
        assertEquals("B", registry.get("t1").orElseThrow().title());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void noResponse_rejectsAfterDeadline() {
        ObjectNode params = mapper.createObjectNode().put("selector", "#missing");
        long start = System.nanoTime();
        CompletableFuture<JsonNode> future = correlator.execute("t1", "click", params, 50);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        CommandTimeoutException timeout = assertInstanceOf(CommandTimeoutException.class, ex.getCause());
        assertEquals("Command timeout: click (selector: #missing)", timeout.getMessage());
        assertEquals("TIMEOUT", timeout.getCode());
        assertTrue(elapsedMs < 1000, "took " + elapsedMs + "ms");
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void timeoutMessage_namesXpath() {
        ObjectNode params = mapper.createObjectNode().put("xpath", "//button");
        CompletableFuture<JsonNode> future = correlator.execute("t1", "hover", params, 20);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertEquals("Command timeout: hover (xpath: //button)", ex.getCause().getMessage());
    }

    @Test
    void secondResponse_isNoOp() throws Exception {
        CompletableFuture<JsonNode> future = correlator.execute("t1", "reload", null, 5000);
        String id = sender.sent.get(0).getId();

        assertTrue(correlator.handleResponse(TabRelayTypes.ResponseMessage.ok(id, mapper.createObjectNode().put("n", 1))));
        assertFalse(correlator.handleResponse(TabRelayTypes.ResponseMessage.ok(id, mapper.createObjectNode().put("n", 2))));

        assertEquals(1, future.get().get("n").asInt());
    }

    @Test
    void lateResponse_afterTimeout_isDiscarded() {
        CompletableFuture<JsonNode> future = correlator.execute("t1", "dom", null, 20);
        String id = sender.sent.get(0).getId();

        assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertFalse(correlator.handleResponse(TabRelayTypes.ResponseMessage.ok(id, null)));
    }

    @Test
    void notConnected_throwsWithoutPendingEntry() {
        assertThrows(TabNotConnectedException.class,
                () -> correlator.execute("ghost", "click", null, 5000));
        assertEquals(0, correlator.pendingCount());
        assertTrue(sender.sent.isEmpty());
    }

    @Test
    void sendFailure_removesPendingEntry() {
        sender.failNext = true;
        assertThrows(TabNotConnectedException.class, () -> correlator.execute("t1", "click", null, 5000));
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void agentError_relayedVerbatim() {
        CompletableFuture<JsonNode> future = correlator.execute("t1", "click", null, 5000);
        String id = sender.sent.get(0).getId();

        correlator.handleResponse(TabRelayTypes.ResponseMessage.failed(id, "ELEMENT_NOT_FOUND", "No element matches #x"));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        TabCommandException failure = assertInstanceOf(TabCommandException.class, ex.getCause());
        assertEquals("ELEMENT_NOT_FOUND", failure.getCode());
        assertEquals("No element matches #x", failure.getMessage());
    }

    @Test
    void agentErrorWithoutCode_usesDefaultCode() {
        CompletableFuture<JsonNode> future = correlator.execute("t1", "click", null, 5000);
        correlator.handleResponse(TabRelayTypes.ResponseMessage.failed(sender.sent.get(0).getId(), null, "boom"));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertEquals("COMMAND_FAILED", ((TabCommandException) ex.getCause()).getCode());
    }

    @Test
    void tabDisconnect_rejectsOnlyItsPendingCommands() {
        registry.register("t2", TabMetadata.builder().build());
        sender.connected.add("t2");
        CompletableFuture<JsonNode> first = correlator.execute("t1", "dom", null, 60_000);
        CompletableFuture<JsonNode> other = correlator.execute("t2", "dom", null, 60_000);

        registry.remove("t1");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> first.get(1, TimeUnit.SECONDS));
        assertInstanceOf(TabNotConnectedException.class, ex.getCause());
        assertFalse(other.isDone());
        assertEquals(1, correlator.pendingCount());
    }

    @Test
    void cleanup_rejectsEverything() {
        CompletableFuture<JsonNode> a = correlator.execute("t1", "dom", null, 60_000);
        CompletableFuture<JsonNode> b = correlator.execute("t1", "elements", null, 60_000);

        correlator.cleanup();

        for (CompletableFuture<JsonNode> f : List.of(a, b)) {
            ExecutionException ex = assertThrows(ExecutionException.class, f::get);
            BrokerException failure = assertInstanceOf(BrokerException.class, ex.getCause());
            assertEquals("Broker shutting down", failure.getMessage());
        }
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void commandIds_areUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            correlator.execute("t1", "dom", null, 60_000);
        }
        sender.sent.forEach(cmd -> ids.add(cmd.getId()));
        assertEquals(100, ids.size());
    }

    private static class FakeSender implements TabCommandSender {
        final Set<String> connected = new HashSet<>();
        final List<TabRelayTypes.CommandMessage> sent = new CopyOnWriteArrayList<>();
        boolean failNext;

        @Override
        public boolean isConnected(String tabId) {
            return connected.contains(tabId);
        }

        @Override
        public void sendCommand(String tabId, TabRelayTypes.CommandMessage command) {
            if (failNext) {
                failNext = false;
                throw new TabNotConnectedException(tabId);
            }
            sent.add(command);
        }
    }
}
