package com.tabrelay.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.ToolValidationException;
import com.tabrelay.common.error.UnknownToolException;
import com.tabrelay.common.model.JsonRpcMessage;
import com.tabrelay.gateway.resources.ResourceHandler;
import com.tabrelay.gateway.session.ClientInfo;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.tools.ToolDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Transport-independent JSON-RPC handling for client sessions. Every transport
 * hands its decoded messages here and delivers whatever response comes back.
 */
@Slf4j
public class McpProtocolHandler {

    private final ObjectMapper mapper;
    private final ClientSessionManager sessionManager;
    private final ToolDispatcher toolDispatcher;
    private final ResourceHandler resourceHandler;
    private final McpMethodRouter router = new McpMethodRouter();

    public McpProtocolHandler(ObjectMapper mapper, ClientSessionManager sessionManager,
                              ToolDispatcher toolDispatcher, ResourceHandler resourceHandler) {
        this.mapper = mapper;
        this.sessionManager = sessionManager;
        this.toolDispatcher = toolDispatcher;
        this.resourceHandler = resourceHandler;
        registerMethods();
    }

    private void registerMethods() {
        router.registerHandshakeMethod(McpProtocolTypes.INITIALIZE, this::initialize);
        router.registerHandshakeMethod(McpProtocolTypes.PING,
                (params, session) -> CompletableFuture.completedFuture(Map.of()));
        router.registerMethod(McpProtocolTypes.TOOLS_LIST,
                (params, session) -> CompletableFuture.completedFuture(Map.of("tools", toolDispatcher.listTools())));
        router.registerMethod(McpProtocolTypes.TOOLS_CALL, this::callTool);
        router.registerMethod(McpProtocolTypes.RESOURCES_LIST,
                (params, session) -> CompletableFuture.completedFuture(Map.of("resources", resourceHandler.list())));
        router.registerMethod(McpProtocolTypes.RESOURCES_READ, this::readResource);

        router.registerNotification(McpProtocolTypes.INITIALIZED, (params, session) -> {
            if (session.completeInitialize()) {
                sessionManager.onInitialized(session);
            } else {
                log.debug("Ignoring initialized notification in state {} for {}", session.getState(), session.getId());
            }
        });
    }

    /**
     * Decode and handle one raw message.
     *
     * @return the response to send, or a future of null when nothing is to be sent
     */
    public CompletableFuture<JsonRpcMessage.Response> handleText(ClientSession session, String text) {
        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Parse error from session {}: {}", session.getId(), e.getOriginalMessage());
            return CompletableFuture.completedFuture(
                    JsonRpcMessage.Response.error(null, JsonRpcMessage.PARSE_ERROR, "Parse error"));
        }
        return handle(session, message);
    }

    public CompletableFuture<JsonRpcMessage.Response> handle(ClientSession session, JsonNode message) {
        if (message != null && message.isArray()) {
            return CompletableFuture.completedFuture(JsonRpcMessage.Response.error(null,
                    JsonRpcMessage.INVALID_REQUEST, "Batch requests are not supported"));
        }
        if (isClientResponse(message)) {
            log.debug("Ignoring client response message on session {}", session.getId());
            return CompletableFuture.completedFuture(null);
        }

        Object id = idOf(message);
        List<String> problems = ProtocolValidation.validateRequest(message);
        if (!problems.isEmpty()) {
            return CompletableFuture.completedFuture(JsonRpcMessage.Response.error(id,
                    JsonRpcMessage.INVALID_REQUEST,
                    "Invalid request: " + ProtocolValidation.formatValidationErrors(problems)));
        }

        String method = message.get("method").asText();
        JsonNode params = message.get("params");

        if (!message.has("id")) {
            router.handleNotification(method, params, session);
            return CompletableFuture.completedFuture(null);
        }

        log.debug("request {} id={} session={}", method, id, session.getId());
        return router.dispatch(method, params, session)
                .handle((result, error) -> error == null
                        ? JsonRpcMessage.Response.success(id, result != null ? result : Map.of())
                        : toErrorResponse(id, method, unwrap(error)));
    }

    public String encode(JsonRpcMessage.Response response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode response id={}: {}", response.getId(), e.getMessage(), e);
            return "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":" + JsonRpcMessage.INTERNAL_ERROR
                    + ",\"message\":\"Failed to encode response\"}}";
        }
    }

    /**
     * True if the decoded message is an initialize request, which is how
     * request/response clients open a session.
     */
    public static boolean isInitializeRequest(JsonNode message) {
        return message != null && message.isObject()
                && McpProtocolTypes.INITIALIZE.equals(message.path("method").asText(null))
                && message.has("id");
    }

    // ==================== Methods ====================

    private CompletableFuture<Object> initialize(JsonNode params, ClientSession session) {
        String requested = params != null ? params.path("protocolVersion").asText(null) : null;
        String version = McpProtocolTypes.negotiateVersion(requested);
        ClientInfo clientInfo = null;
        if (params != null && params.hasNonNull("clientInfo")) {
            clientInfo = mapper.convertValue(params.get("clientInfo"), ClientInfo.class);
        }
        session.beginInitialize(version, clientInfo);
        log.info("initialize: session={} client={} requested={} negotiated={}",
                session.getId(), clientInfo, requested, version);

        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("tools", Map.of("listChanged", false));
        capabilities.put("resources", Map.of("subscribe", false, "listChanged", true));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", version);
        result.put("capabilities", capabilities);
        result.put("serverInfo", Map.of(
                "name", McpProtocolTypes.SERVER_NAME,
                "version", McpProtocolTypes.SERVER_VERSION));
        result.put("instructions", "Drive connected browser tabs. Call list_tabs first, or new_tab to open one.");
        return CompletableFuture.completedFuture(result);
    }

    private CompletableFuture<Object> callTool(JsonNode params, ClientSession session) {
        String name = params != null ? params.path("name").asText(null) : null;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tools/call requires a tool name");
        }
        JsonNode arguments = params.get("arguments");
        return toolDispatcher.invoke(name, arguments).thenApply(result -> result);
    }

    private CompletableFuture<Object> readResource(JsonNode params, ClientSession session) {
        String uri = params != null ? params.path("uri").asText(null) : null;
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("resources/read requires a uri");
        }
        return resourceHandler.read(uri).thenApply(result -> result);
    }

    // ==================== Error mapping ====================

    private JsonRpcMessage.Response toErrorResponse(Object id, String method, Throwable error) {
        if (error instanceof McpMethodRouter.MethodNotFoundException) {
            return JsonRpcMessage.Response.error(id, JsonRpcMessage.METHOD_NOT_FOUND, error.getMessage());
        }
        if (error instanceof McpMethodRouter.NotInitializedException) {
            log.debug("Rejected {} before initialize", method);
            return JsonRpcMessage.Response.error(id, JsonRpcMessage.SERVER_NOT_INITIALIZED, "Server not initialized");
        }
        if (error instanceof ToolValidationException invalid) {
            return JsonRpcMessage.Response.error(id, JsonRpcMessage.INVALID_PARAMS,
                    "Invalid arguments for tool " + invalid.getToolName() + ": "
                            + ProtocolValidation.formatValidationErrors(invalid.getErrors()),
                    Map.of("errors", invalid.getErrors()));
        }
        if (error instanceof UnknownToolException || error instanceof IllegalArgumentException) {
            return JsonRpcMessage.Response.error(id, JsonRpcMessage.INVALID_PARAMS, error.getMessage());
        }
        if (error instanceof BrokerException broker) {
            int code = ResourceHandler.NOT_FOUND.equals(broker.getCode())
                    ? JsonRpcMessage.INVALID_PARAMS : JsonRpcMessage.INTERNAL_ERROR;
            return JsonRpcMessage.Response.error(id, code, broker.getMessage(), Map.of("code", broker.getCode()));
        }
        log.error("Unexpected failure handling {}: {}", method, error.getMessage(), error);
        return JsonRpcMessage.Response.error(id, JsonRpcMessage.INTERNAL_ERROR,
                "Internal error: " + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName()));
    }

    private static boolean isClientResponse(JsonNode message) {
        return message != null && message.isObject() && !message.has("method")
                && (message.has("result") || message.has("error"));
    }

    private static Object idOf(JsonNode message) {
        if (message == null || !message.isObject()) {
            return null;
        }
        JsonNode id = message.get("id");
        if (id == null || id.isNull()) {
            return null;
        }
        if (id.isNumber()) {
            return id.numberValue();
        }
        return id.isTextual() ? id.asText() : null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
