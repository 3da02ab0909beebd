package com.tabrelay.browser.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tabrelay.browser.tabs.TabMetadata;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabRegistryEvent;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.CommandTimeoutException;
import com.tabrelay.common.error.TabCommandException;
import com.tabrelay.common.error.TabNotConnectedException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Matches tab agent responses to the commands that caused them.
 *
 * <p>Each command gets a fresh id and one pending entry holding its future and
 * deadline timer. Whoever removes the entry first (response, timeout, tab
 * disconnect or shutdown) settles the future; later arrivals find nothing.
 */
@Slf4j
public class CommandCorrelator implements CommandExecutor {

    public static final String SHUTTING_DOWN = "SHUTTING_DOWN";

    private final Map<String, PendingCommand> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final TabCommandSender sender;
    private final TabRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Runnable unsubscribe;

    public CommandCorrelator(TabCommandSender sender, TabRegistry registry, ScheduledExecutorService scheduler) {
        this.sender = sender;
        this.registry = registry;
        this.scheduler = scheduler;
        this.unsubscribe = registry.subscribe(this::onRegistryEvent);
    }

    @Override
    public CompletableFuture<JsonNode> execute(String tabId, String command, JsonNode params, long timeoutMs) {
        if (!sender.isConnected(tabId)) {
            throw new TabNotConnectedException(tabId);
        }

        String commandId = nextCommandId();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        PendingCommand entry = PendingCommand.builder()
                .tabId(tabId)
                .command(command)
                .params(params)
                .timeoutMs(timeoutMs)
                .future(future)
                .build();
        pending.put(commandId, entry);
        entry.setTimeoutTask(scheduler.schedule(() -> onTimeout(commandId), timeoutMs, TimeUnit.MILLISECONDS));

        try {
            sender.sendCommand(tabId, TabRelayTypes.CommandMessage.create(commandId, command, params));
        } catch (RuntimeException e) {
            pending.remove(commandId);
            entry.cancelTimer();
            throw e;
        }
        log.debug("command sent: id={} tab={} command={} timeoutMs={}", commandId, tabId, command, timeoutMs);
        return future;
    }

    /**
     * Settle the command a response refers to.
     *
     * @return false if no command with that id is pending
     */
    public boolean handleResponse(TabRelayTypes.ResponseMessage response) {
        String id = response.getId();
        PendingCommand entry = id != null ? pending.remove(id) : null;
        if (entry == null) {
            log.warn("Response for unknown or settled command: id={}", id);
            return false;
        }
        entry.cancelTimer();

        if (response.isSuccess()) {
            JsonNode result = response.getResult() != null ? response.getResult() : NullNode.getInstance();
            refreshTabMetadata(entry.tabId, result);
            entry.future.complete(result);
        } else {
            TabRelayTypes.ErrorInfo error = response.getError();
            entry.future.completeExceptionally(new TabCommandException(
                    error != null ? error.getCode() : null,
                    error != null ? error.getMessage() : null));
        }
        return true;
    }

    /**
     * Reject every pending command. Used at shutdown.
     */
    public void cleanup() {
        int count = rejectWhere(null, () -> new BrokerException(SHUTTING_DOWN, "Broker shutting down"));
        unsubscribe.run();
        if (count > 0) {
            log.info("Rejected {} pending commands on shutdown", count);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private void onTimeout(String commandId) {
        PendingCommand entry = pending.remove(commandId);
        if (entry == null) {
            return;
        }
        String message = "Command timeout: " + entry.command + describeTarget(entry.params);
        log.warn("{} (tab={}, id={})", message, entry.tabId, commandId);
        entry.future.completeExceptionally(new CommandTimeoutException(entry.command, message, entry.timeoutMs));
    }

    private void onRegistryEvent(TabRegistryEvent event) {
        if (event.type() != TabRegistryEvent.Type.DISCONNECTED) {
            return;
        }
        int count = rejectWhere(event.tabId(), () -> new TabNotConnectedException(event.tabId()));
        if (count > 0) {
            log.info("Rejected {} pending commands for disconnected tab {}", count, event.tabId());
        }
    }

    private int rejectWhere(String tabId, Supplier<BrokerException> failure) {
        int count = 0;
        for (String id : pending.keySet()) {
            PendingCommand entry = pending.get(id);
            if (entry == null || (tabId != null && !tabId.equals(entry.tabId))) {
                continue;
            }
            if (pending.remove(id, entry)) {
                entry.cancelTimer();
                entry.future.completeExceptionally(failure.get());
                count++;
            }
        }
        return count;
    }

    private void refreshTabMetadata(String tabId, JsonNode result) {
        if (result == null || !result.isObject()) {
            return;
        }
        String url = result.path("url").isTextual() ? result.get("url").asText() : null;
        String title = result.path("title").isTextual() ? result.get("title").asText() : null;
        if (url != null || title != null) {
            registry.update(tabId, TabMetadata.builder().url(url).title(title).build());
        }
    }

    private static String describeTarget(JsonNode params) {
        if (params == null) {
            return "";
        }
        if (params.hasNonNull("selector")) {
            return " (selector: " + params.get("selector").asText() + ")";
        }
        if (params.hasNonNull("xpath")) {
            return " (xpath: " + params.get("xpath").asText() + ")";
        }
        return "";
    }

    private String nextCommandId() {
        return "cmd-" + System.currentTimeMillis() + "-" + sequence.incrementAndGet();
    }

    @Data
    @Builder
    private static class PendingCommand {
        private final String tabId;
        private final String command;
        private final JsonNode params;
        private final long timeoutMs;
        private final CompletableFuture<JsonNode> future;
        private volatile ScheduledFuture<?> timeoutTask;

        void cancelTimer() {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
