package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.relay.CommandExecutor;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabSession;
import com.tabrelay.browser.tabs.TabViews;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Builds the list_tabs answer: every browser tab the connected instances know about,
 * marked with whether it is connected and whether it is safe to automate.
 */
@Slf4j
public class TabListing {

    static final String NO_TABS_HINT = "There currently are no tabs connected. Use the new_tab tool to create one!";
    static final String NONE_CONNECTED_HINT = "No tabs are currently connected to the server.";

    private final CommandExecutor executor;
    private final TabRegistry registry;
    private final ObjectMapper mapper;
    private final List<String> chatClientHosts;
    private final long queryTimeoutMs;

    public TabListing(CommandExecutor executor, TabRegistry registry, ObjectMapper mapper,
                      List<String> chatClientHosts, long queryTimeoutMs) {
        this.executor = executor;
        this.registry = registry;
        this.mapper = mapper;
        this.chatClientHosts = chatClientHosts.stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .toList();
        this.queryTimeoutMs = queryTimeoutMs;
    }

    public CompletableFuture<Map<String, Object>> list() {
        List<TabSession> connected = registry.getAll();
        if (connected.isEmpty()) {
            return CompletableFuture.completedFuture(withTabs(List.of()));
        }

        // One representative per browser instance; instance-less tabs only count when no instance is known
        Map<String, String> representatives = new LinkedHashMap<>();
        String legacy = null;
        for (TabSession tab : connected) {
            String instance = tab.browserInstanceId();
            if (instance != null && !instance.isBlank()) {
                representatives.putIfAbsent(instance, tab.tabId());
            } else if (legacy == null) {
                legacy = tab.tabId();
            }
        }

        List<CompletableFuture<List<Map<String, Object>>>> queries = new ArrayList<>();
        representatives.forEach((instance, tabId) -> queries.add(queryInstance(tabId, instance)));
        if (representatives.isEmpty() && legacy != null) {
            queries.add(queryInstance(legacy, null));
        }

        Set<String> connectedIds = connected.stream().map(TabSession::tabId).collect(Collectors.toSet());
        return CompletableFuture.allOf(queries.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<Map<String, Object>> tabs = new ArrayList<>();
                    queries.forEach(q -> tabs.addAll(q.join()));
                    if (tabs.isEmpty()) {
                        return withTabs(registryView(connected));
                    }
                    tabs.forEach(t -> t.put("connected", isConnected(t, connectedIds)));
                    return withTabs(tabs);
                });
    }

    private CompletableFuture<List<Map<String, Object>>> queryInstance(String tabId, String instanceId) {
        CompletableFuture<JsonNode> reply;
        try {
            reply = executor.execute(tabId, "getAllTabs", mapper.createObjectNode(), queryTimeoutMs);
        } catch (RuntimeException e) {
            log.warn("Tab query via {} failed: {}", tabId, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
        return reply.handle((result, error) -> {
            if (error != null) {
                log.warn("Tab query for instance {} via {} failed: {}", instanceId, tabId, error.getMessage());
                return List.of();
            }
            List<Map<String, Object>> tabs = new ArrayList<>();
            if (result == null || !result.isArray()) {
                return tabs;
            }
            for (JsonNode node : result) {
                String rawId = node.path("id").asText("");
                if (rawId.isEmpty()) {
                    continue;
                }
                String url = node.path("url").asText("");
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("tabId", instanceId != null ? instanceId + ":" + rawId : rawId);
                entry.put("rawId", rawId);
                entry.put("title", node.path("title").asText(""));
                entry.put("url", url);
                entry.put("active", node.path("active").asBoolean(false));
                entry.put("safeForAutomation", isSafeForAutomation(url));
                tabs.add(entry);
            }
            return tabs;
        });
    }

    private List<Map<String, Object>> registryView(List<TabSession> connected) {
        List<Map<String, Object>> tabs = new ArrayList<>();
        for (TabSession tab : connected) {
            Map<String, Object> entry = TabViews.detail(tab);
            entry.put("connected", true);
            entry.put("safeForAutomation", isSafeForAutomation(tab.url()));
            tabs.add(entry);
        }
        return tabs;
    }

    private static boolean isConnected(Map<String, Object> entry, Set<String> connectedIds) {
        Object rawId = entry.remove("rawId");
        return connectedIds.contains(String.valueOf(entry.get("tabId"))) || connectedIds.contains(String.valueOf(rawId));
    }

    private Map<String, Object> withTabs(List<Map<String, Object>> tabs) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tabs", tabs);
        String hint = hint(tabs);
        if (hint != null) {
            result.put("hint", hint);
        }
        return result;
    }

    private static String hint(List<Map<String, Object>> tabs) {
        if (tabs.isEmpty()) {
            return NO_TABS_HINT;
        }
        boolean anyConnected = tabs.stream().anyMatch(t -> Boolean.TRUE.equals(t.get("connected")));
        if (!anyConnected) {
            return NONE_CONNECTED_HINT;
        }
        boolean anyUnsafe = tabs.stream().anyMatch(t -> Boolean.FALSE.equals(t.get("safeForAutomation")));
        if (!anyUnsafe) {
            return null;
        }
        return tabs.stream()
                .filter(t -> Boolean.TRUE.equals(t.get("connected")) && Boolean.TRUE.equals(t.get("safeForAutomation")))
                .findFirst()
                .map(t -> "Some tabs belong to chat clients and must not be automated. Use tab "
                        + t.get("tabId") + " (" + t.get("title") + ") instead.")
                .orElse("Some tabs belong to chat clients and must not be automated. "
                        + "Use the new_tab tool to open a tab that is safe to automate.");
    }

    boolean isSafeForAutomation(String url) {
        if (url == null || url.isBlank()) {
            return true;
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return true;
        }
        if (host == null) {
            return true;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        return chatClientHosts.stream()
                .noneMatch(denied -> normalized.equals(denied) || normalized.endsWith("." + denied));
    }
}
