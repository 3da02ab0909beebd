package com.tabrelay.gateway.server;

import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabViews;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.session.TransportKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Status documents for supervisory tooling: the session list at {@code /} and the
 * aggregate health document at {@code /health} and {@code /status}.
 */
public class DiagnosticsDocuments {

    private final ClientSessionManager sessions;
    private final TabRegistry registry;
    private final Clock clock;
    private final Instant startedAt;

    public DiagnosticsDocuments(ClientSessionManager sessions, TabRegistry registry, Clock clock) {
        this.sessions = sessions;
        this.registry = registry;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public List<Map<String, Object>> sessionList() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (ClientSession session : sessions.getAll()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", session.getId());
            entry.put("type", session.getTransport().label());
            entry.put("clientInfo", session.getClientInfo());
            entry.put("initialized", session.isInitialized());
            entry.put("state", session.getState().label());
            list.add(entry);
        }
        return list;
    }

    public Map<String, Object> status() {
        Instant now = clock.instant();
        List<ClientSession> all = sessions.getAll();

        List<Map<String, Object>> details = new ArrayList<>();
        List<Map<String, Object>> httpDetails = new ArrayList<>();
        for (ClientSession session : all) {
            Map<String, Object> view = sessions.describe(session);
            details.add(view);
            if (session.getTransport() == TransportKind.HTTP) {
                httpDetails.add(view);
            }
        }

        Map<String, Object> connections = new LinkedHashMap<>();
        connections.put("total", all.size());
        connections.put("websocket", sessions.count(TransportKind.WEBSOCKET));
        connections.put("sse", sessions.count(TransportKind.SSE));
        connections.put("http", sessions.count(TransportKind.HTTP));
        connections.put("initialized", sessions.initializedCount());
        connections.put("details", details);

        Map<String, Object> http = new LinkedHashMap<>();
        http.put("count", httpDetails.size());
        http.put("defaultTimeoutMs", sessions.getDefaultHttpTimeoutMs());
        http.put("details", httpDetails);

        Map<String, Object> sessionCounts = new LinkedHashMap<>();
        sessionCounts.put("sse", sessions.count(TransportKind.SSE));
        sessionCounts.put("http", http);

        List<Map<String, Object>> tabDetails = new ArrayList<>();
        registry.getAll().forEach(tab -> tabDetails.add(TabViews.detail(tab)));
        Map<String, Object> tabs = new LinkedHashMap<>();
        tabs.put("total", tabDetails.size());
        tabs.put("details", tabDetails);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("status", "ok");
        document.put("timestamp", now.toString());
        document.put("uptimeMs", now.toEpochMilli() - startedAt.toEpochMilli());
        document.put("connections", connections);
        document.put("sessions", sessionCounts);
        document.put("tabs", tabs);
        return document;
    }
}
