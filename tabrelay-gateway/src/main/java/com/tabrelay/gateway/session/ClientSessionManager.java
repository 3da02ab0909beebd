package com.tabrelay.gateway.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabRegistryEvent;
import com.tabrelay.browser.tabs.TabViews;
import com.tabrelay.common.error.UnknownSessionException;
import com.tabrelay.common.model.JsonRpcMessage;
import com.tabrelay.gateway.protocol.McpProtocolTypes;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tracks every client session across the three transports and fans registry
 * changes out to the initialized ones.
 *
 * <p>Only request/response (HTTP) sessions expire by idleness; socket and stream
 * sessions end when their transport closes.
 */
@Slf4j
public class ClientSessionManager {

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final TabRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    @Getter
    private final long defaultHttpTimeoutMs;
    private final long sweepIntervalMs;

    private Runnable unsubscribe;
    private ScheduledFuture<?> sweepTask;

    public ClientSessionManager(ObjectMapper mapper, TabRegistry registry, ScheduledExecutorService scheduler,
                                Clock clock, long defaultHttpTimeoutMs, long sweepIntervalMs) {
        this.mapper = mapper;
        this.registry = registry;
        this.scheduler = scheduler;
        this.clock = clock;
        this.defaultHttpTimeoutMs = defaultHttpTimeoutMs;
        this.sweepIntervalMs = sweepIntervalMs;
    }

    /**
     * Subscribe to the registry and start the idle sweep.
     */
    public synchronized void start() {
        if (unsubscribe == null) {
            unsubscribe = registry.subscribe(this::onRegistryEvent);
        }
        if (sweepTask == null) {
            sweepTask = scheduler.scheduleAtFixedRate(this::sweepIdle,
                    sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stop the sweep and close every session.
     */
    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (unsubscribe != null) {
            unsubscribe.run();
            unsubscribe = null;
        }
        List<String> ids = new ArrayList<>(sessions.keySet());
        ids.forEach(this::close);
        if (!ids.isEmpty()) {
            log.info("Closed {} client sessions", ids.size());
        }
    }

    // ==================== Session lifecycle ====================

    public ClientSession create(TransportKind transport, MessageSink sink, Long timeoutMs) {
        String id = UUID.randomUUID().toString();
        ClientSession session = new ClientSession(id, transport, sink, clock.instant(), timeoutMs);
        sessions.put(id, session);
        log.info("client session open: id={} transport={}{}", id, transport.label(),
                timeoutMs != null ? " timeoutMs=" + timeoutMs : "");
        return session;
    }

    public Optional<ClientSession> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * Look up a session for a follow-up request and record the activity.
     *
     * @throws UnknownSessionException if no live session has this id
     */
    public ClientSession require(String id) {
        ClientSession session = id != null ? sessions.get(id) : null;
        if (session == null || session.isClosed()) {
            log.warn("Rejected request for unknown session: {}", id);
            throw new UnknownSessionException(id);
        }
        session.touch(clock.instant());
        return session;
    }

    public boolean close(String id) {
        ClientSession session = id != null ? sessions.remove(id) : null;
        if (session == null) {
            return false;
        }
        session.close();
        log.info("client session close: id={} transport={}", id, session.getTransport().label());
        return true;
    }

    /**
     * Called once a session has sent its initialized acknowledgment.
     */
    public void onInitialized(ClientSession session) {
        log.info("client session initialized: id={} client={} protocol={}", session.getId(),
                session.getClientInfo(), session.getProtocolVersion());
        if (registry.size() > 0) {
            String json = serialize(tabsChanged());
            if (json != null) {
                session.send(json);
            }
        }
    }

    /**
     * Remove HTTP sessions idle longer than their timeout.
     *
     * @return number of sessions removed
     */
    public int sweepIdle() {
        Instant now = clock.instant();
        int removed = 0;
        for (ClientSession session : new ArrayList<>(sessions.values())) {
            if (session.getTransport() != TransportKind.HTTP || !session.isExpired(now, defaultHttpTimeoutMs)) {
                continue;
            }
            log.warn("HTTP session expired: id={} idleMs={}", session.getId(),
                    now.toEpochMilli() - session.getLastActivity().toEpochMilli());
            if (close(session.getId())) {
                removed++;
            }
        }
        return removed;
    }

    // ==================== Fan-out ====================

    public void onConsoleLog(String tabId, JsonNode logEntry) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tabId", tabId);
        params.put("logEntry", logEntry);
        params.put("timestamp", clock.millis());
        broadcast(JsonRpcMessage.Notification.create(McpProtocolTypes.CONSOLE_LOG, params));
    }

    void onRegistryEvent(TabRegistryEvent event) {
        broadcast(JsonRpcMessage.Notification.create(McpProtocolTypes.RESOURCES_LIST_CHANGED, Map.of()));
        if (event.type() == TabRegistryEvent.Type.DISCONNECTED) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("tabId", event.tabId());
            params.put("timestamp", clock.millis());
            broadcast(JsonRpcMessage.Notification.create(McpProtocolTypes.TAB_DISCONNECTED, params));
        }
        broadcast(tabsChanged());
    }

    /**
     * Send a notification to every initialized session.
     *
     * @return number of sessions it was delivered to
     */
    public int broadcast(JsonRpcMessage.Notification notification) {
        String json = serialize(notification);
        if (json == null) {
            return 0;
        }
        int delivered = 0;
        for (ClientSession session : sessions.values()) {
            if (session.isInitialized() && session.send(json)) {
                delivered++;
            }
        }
        log.debug("notification {} delivered to {} sessions", notification.getMethod(), delivered);
        return delivered;
    }

    private JsonRpcMessage.Notification tabsChanged() {
        List<Map<String, Object>> tabs = new ArrayList<>();
        registry.getAll().forEach(t -> tabs.add(TabViews.summary(t)));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tabs", tabs);
        params.put("timestamp", clock.millis());
        return JsonRpcMessage.Notification.create(McpProtocolTypes.TABS_CHANGED, params);
    }

    private String serialize(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode notification: {}", e.getMessage(), e);
            return null;
        }
    }

    // ==================== Diagnostics ====================

    public List<ClientSession> getAll() {
        List<ClientSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(ClientSession::getCreatedAt));
        return all;
    }

    public int count(TransportKind transport) {
        return (int) sessions.values().stream().filter(s -> s.getTransport() == transport).count();
    }

    public int initializedCount() {
        return (int) sessions.values().stream().filter(ClientSession::isInitialized).count();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Per-session summary used by the status endpoints.
     */
    public Map<String, Object> describe(ClientSession session) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", session.getId());
        view.put("type", session.getTransport().label());
        view.put("clientInfo", session.getClientInfo());
        view.put("initialized", session.isInitialized());
        view.put("state", session.getState().label());
        view.put("protocolVersion", session.getProtocolVersion());
        view.put("createdAt", session.getCreatedAt().toString());
        view.put("lastActivityAt", session.getLastActivity().toString());
        if (session.getTransport() == TransportKind.HTTP) {
            long timeout = session.getTimeoutMs() != null ? session.getTimeoutMs() : defaultHttpTimeoutMs;
            view.put("timeoutMs", timeout);
            view.put("idleMs", clock.millis() - session.getLastActivity().toEpochMilli());
        }
        return view;
    }
}
