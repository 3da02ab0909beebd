package com.tabrelay.gateway.tools;

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
import com.tabrelay.common.error.ToolValidationException;
import com.tabrelay.common.error.UnknownToolException;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs tools/call requests: validates arguments, routes broker-local tools,
 * forwards the rest to the tab agent and shapes the result.
 *
 * <p>Unknown tools and invalid arguments are thrown before anything is dispatched.
 * Failures after that point come back as a {@link ToolResult} with the error flag set.
 */
@Slf4j
public class ToolDispatcher {

    static final String NO_ACTIVE_TAB_HINT =
            "No active tab found. The currently focused browser tab may not be connected to the server.";
    private static final List<String> SCREENSHOT_QUERY_PARAMS = List.of("selector", "xpath", "scale", "format", "quality");

    private final ToolCatalog catalog;
    private final ArgumentValidator validator;
    private final CommandExecutor executor;
    private final TabRegistry registry;
    private final TabListing tabListing;
    private final NewTabOpener newTabOpener;
    private final ObjectMapper mapper;
    private final long defaultTimeoutMs;
    private final String baseUrl;

    public ToolDispatcher(ToolCatalog catalog, ArgumentValidator validator, CommandExecutor executor,
                          TabRegistry registry, TabListing tabListing, NewTabOpener newTabOpener,
                          ObjectMapper mapper, long defaultTimeoutMs, String baseUrl) {
        this.catalog = catalog;
        this.validator = validator;
        this.executor = executor;
        this.registry = registry;
        this.tabListing = tabListing;
        this.newTabOpener = newTabOpener;
        this.mapper = mapper;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.baseUrl = baseUrl;
    }

    public List<ToolDefinition> listTools() {
        return catalog.list();
    }

    /**
     * @throws UnknownToolException    if no tool has this name
     * @throws ToolValidationException if the arguments do not satisfy the tool's schema
     */
    public CompletableFuture<ToolResult> invoke(String toolName, JsonNode rawArgs) {
        ToolDefinition tool = catalog.find(toolName).orElseThrow(() -> new UnknownToolException(toolName));
        List<String> errors = validator.validate(tool, rawArgs);
        if (!errors.isEmpty()) {
            log.debug("Rejected {} call: {}", toolName, errors);
            throw new ToolValidationException(toolName, errors);
        }
        ObjectNode args = rawArgs instanceof ObjectNode object ? object : mapper.createObjectNode();

        CompletableFuture<?> outcome;
        try {
            outcome = route(tool, args);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        return outcome.handle((value, error) -> {
            if (error != null) {
                return errorResult(toolName, unwrap(error));
            }
            if ("screenshot".equals(toolName) && value instanceof JsonNode node && node.hasNonNull("data")) {
                return screenshotResult(args, (ObjectNode) node);
            }
            return ToolResult.text(toJson(value));
        });
    }

    private CompletableFuture<?> route(ToolDefinition tool, ObjectNode args) {
        switch (tool.getName()) {
            case "list_tabs":
                return tabListing.list();
            case "new_tab":
                return newTabOpener.open(args.hasNonNull("browser") ? args.get("browser").asText() : null);
            case "tab_detail": {
                String tabId = args.path("tabId").asText();
                TabSession tab = registry.get(tabId).orElseThrow(() -> new TabNotConnectedException(tabId));
                return CompletableFuture.completedFuture(TabViews.detail(tab));
            }
            case "get_active_tab":
                return CompletableFuture.completedFuture(registry.getActiveTab()
                        .<Map<String, Object>>map(TabViews::detail)
                        .orElseGet(() -> {
                            Map<String, Object> none = new LinkedHashMap<>();
                            none.put("tab", null);
                            none.put("hint", NO_ACTIVE_TAB_HINT);
                            return none;
                        }));
            default:
                return forward(tool, args);
        }
    }

    private CompletableFuture<JsonNode> forward(ToolDefinition tool, ObjectNode args) {
        String tabId = args.path("tabId").asText(null);
        ObjectNode params = args.deepCopy();
        params.remove("tabId");
        long timeoutMs = TimeoutPolicy.commandTimeout(tool.getName(), args, defaultTimeoutMs);
        log.debug("tools/call {} -> tab {} command {} timeoutMs={}", tool.getName(), tabId, tool.remoteCommand(), timeoutMs);
        return executor.execute(tabId, tool.remoteCommand(), params, timeoutMs);
    }

    private ToolResult screenshotResult(ObjectNode args, ObjectNode result) {
        ObjectNode described = mapper.createObjectNode();
        described.put("preview", previewUrl(args));
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"data".equals(field.getKey()) && !"dataUrl".equals(field.getKey())) {
                described.set(field.getKey(), field.getValue());
            }
        }
        String mimeType = result.path("mimeType").asText("image/webp");
        return ToolResult.text(toJson(described)).withImage(mimeType, result.get("data").asText());
    }

    String previewUrl(ObjectNode args) {
        StringJoiner query = new StringJoiner("&");
        for (String name : SCREENSHOT_QUERY_PARAMS) {
            JsonNode value = args.get(name);
            if (value != null && !value.isNull()) {
                query.add(name + "=" + URLEncoder.encode(value.asText(), StandardCharsets.UTF_8));
            }
        }
        String tabId = URLEncoder.encode(args.path("tabId").asText(), StandardCharsets.UTF_8);
        String url = baseUrl + "/tab/" + tabId + "/screenshot/view";
        return query.length() > 0 ? url + "?" + query : url;
    }

    private ToolResult errorResult(String toolName, Throwable error) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        if (error instanceof BrokerException broker) {
            detail.put("code", broker.getCode());
            log.info("Tool {} failed: [{}] {}", toolName, broker.getCode(), broker.getMessage());
        } else {
            log.error("Tool {} failed unexpectedly", toolName, error);
        }
        return ToolResult.failure(toJson(Map.of("error", detail)));
    }

    private String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BrokerException("ENCODING_FAILED", "Failed to encode tool result", e);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
