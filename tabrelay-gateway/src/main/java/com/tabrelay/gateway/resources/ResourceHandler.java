package com.tabrelay.gateway.resources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.browser.relay.CommandExecutor;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabSession;
import com.tabrelay.browser.tabs.TabViews;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.TabNotConnectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only views of tabs exposed as protocol resources and as plain HTTP endpoints.
 */
@Slf4j
public class ResourceHandler {

    public static final String SCHEME = "tabrelay://";
    public static final String TABS_URI = SCHEME + "tabs";
    public static final String NOT_FOUND = "RESOURCE_NOT_FOUND";

    private static final Pattern TAB_URI = Pattern.compile("^tabrelay://tab/([^/]+)(?:/(console|screenshot))?$");

    private final TabRegistry registry;
    private final CommandExecutor executor;
    private final ObjectMapper mapper;
    private final long timeoutMs;

    public ResourceHandler(TabRegistry registry, CommandExecutor executor, ObjectMapper mapper, long timeoutMs) {
        this.registry = registry;
        this.executor = executor;
        this.mapper = mapper;
        this.timeoutMs = timeoutMs;
    }

    /**
     * The fixed tab list resource plus three resources per connected tab.
     */
    public List<Map<String, Object>> list() {
        List<Map<String, Object>> resources = new ArrayList<>();
        resources.add(resource(TABS_URI, "Connected tabs", "List of tabs connected to the broker", "application/json"));
        for (TabSession tab : registry.getAll()) {
            String title = tab.title() != null && !tab.title().isBlank() ? tab.title() : "Tab " + tab.tabId();
            String base = SCHEME + "tab/" + tab.tabId();
            resources.add(resource(base, title, "Details of tab " + tab.tabId(), "application/json"));
            resources.add(resource(base + "/console", title + " console",
                    "Console output of tab " + tab.tabId(), "application/json"));
            resources.add(resource(base + "/screenshot", title + " screenshot",
                    "Screenshot of tab " + tab.tabId(), "image/webp"));
        }
        return resources;
    }

    /**
     * resources/read: returns {@code {contents: [...]}} for the given URI.
     */
    public CompletableFuture<Map<String, Object>> read(String uri) {
        try {
            return doRead(uri);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Map<String, Object>> doRead(String uri) {
        if (TABS_URI.equals(uri)) {
            return CompletableFuture.completedFuture(contents(textContent(uri, tabs())));
        }
        Matcher m = uri != null ? TAB_URI.matcher(uri) : null;
        if (m == null || !m.matches()) {
            return CompletableFuture.failedFuture(new BrokerException(NOT_FOUND, "Unknown resource: " + uri));
        }
        String tabId = m.group(1);
        String part = m.group(2);
        if (part == null) {
            return CompletableFuture.completedFuture(contents(textContent(uri, tab(tabId))));
        }
        if ("console".equals(part)) {
            return console(tabId, mapper.createObjectNode()).thenApply(logs -> contents(textContent(uri, logs)));
        }
        return screenshot(tabId, mapper.createObjectNode()).thenApply(shot -> {
            ObjectNode meta = shot.deepCopy();
            meta.remove("data");
            meta.remove("dataUrl");
            Map<String, Object> blob = new LinkedHashMap<>();
            blob.put("uri", uri);
            blob.put("mimeType", shot.path("mimeType").asText("image/webp"));
            blob.put("blob", shot.path("data").asText(""));
            return contents(textContent(uri, meta), blob);
        });
    }

    public Map<String, Object> tabs() {
        List<Map<String, Object>> tabs = new ArrayList<>();
        registry.getAll().forEach(t -> tabs.add(TabViews.summary(t)));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tabs", tabs);
        return result;
    }

    public Map<String, Object> tab(String tabId) {
        return registry.get(tabId).map(TabViews::detail)
                .orElseThrow(() -> new TabNotConnectedException(tabId));
    }

    public CompletableFuture<JsonNode> console(String tabId, ObjectNode params) {
        return executeOn(tabId, "getLogs", params);
    }

    /**
     * Raw screenshot result, inline data included.
     */
    public CompletableFuture<JsonNode> screenshot(String tabId, ObjectNode params) {
        return executeOn(tabId, "screenshot", params).thenApply(result -> {
            if (!result.isObject() || !result.hasNonNull("data")) {
                throw new BrokerException("NO_IMAGE", "Screenshot returned no image data");
            }
            return result;
        });
    }

    private CompletableFuture<JsonNode> executeOn(String tabId, String command, ObjectNode params) {
        if (!registry.contains(tabId)) {
            return CompletableFuture.failedFuture(new TabNotConnectedException(tabId));
        }
        try {
            return executor.execute(tabId, command, params, timeoutMs);
        } catch (BrokerException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Map<String, Object> textContent(String uri, Object value) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("uri", uri);
        content.put("mimeType", "application/json");
        content.put("text", toJson(value));
        return content;
    }

    @SafeVarargs
    private static Map<String, Object> contents(Map<String, Object>... parts) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("contents", List.of(parts));
        return result;
    }

    private static Map<String, Object> resource(String uri, String name, String description, String mimeType) {
        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("uri", uri);
        resource.put("name", name);
        resource.put("description", description);
        resource.put("mimeType", mimeType);
        return resource;
    }

    private String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BrokerException("ENCODING_FAILED", "Failed to encode resource", e);
        }
    }
}
