package com.tabrelay.gateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.SessionState;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes JSON-RPC calls to registered handlers and enforces which methods a
 * session may call before its handshake.
 */
@Slf4j
public class McpMethodRouter {

    @FunctionalInterface
    public interface MethodHandler {
        CompletableFuture<Object> handle(JsonNode params, ClientSession session);
    }

    @FunctionalInterface
    public interface NotificationHandler {
        void handle(JsonNode params, ClientSession session);
    }

    /** Raised for methods nobody registered. */
    public static class MethodNotFoundException extends RuntimeException {
        public MethodNotFoundException(String method) {
            super("Method not found: " + method);
        }
    }

    /** Raised when a session calls a post-handshake method too early. */
    public static class NotInitializedException extends RuntimeException {
        public NotInitializedException(String method) {
            super("Server not initialized: " + method + " requires initialize first");
        }
    }

    private record Route(MethodHandler handler, boolean allowedBeforeInitialize) {
    }

    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final Map<String, NotificationHandler> notificationHandlers = new ConcurrentHashMap<>();

    /**
     * Register a method usable only after initialize.
     */
    public void registerMethod(String method, MethodHandler handler) {
        register(method, handler, false);
    }

    /**
     * Register a method a fresh session may call, such as initialize or ping.
     */
    public void registerHandshakeMethod(String method, MethodHandler handler) {
        register(method, handler, true);
    }

    private void register(String method, MethodHandler handler, boolean allowedBeforeInitialize) {
        routes.put(method, new Route(handler, allowedBeforeInitialize));
        log.debug("Registered method handler: {}{}", method, allowedBeforeInitialize ? " (pre-handshake)" : "");
    }

    public void registerNotification(String method, NotificationHandler handler) {
        notificationHandlers.put(method, handler);
        log.debug("Registered notification handler: {}", method);
    }

    /**
     * Dispatch a request. Every failure, including an unknown method or a premature
     * call, surfaces as a failed future.
     */
    public CompletableFuture<Object> dispatch(String method, JsonNode params, ClientSession session) {
        Route route = routes.get(method);
        if (route == null) {
            return CompletableFuture.failedFuture(new MethodNotFoundException(method));
        }
        if (!route.allowedBeforeInitialize() && session.getState() == SessionState.CREATED) {
            return CompletableFuture.failedFuture(new NotInitializedException(method));
        }

        try {
            return route.handler().handle(params, session);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Handle a notification. Notifications never produce errors on the wire, so
     * failures are only logged.
     */
    public void handleNotification(String method, JsonNode params, ClientSession session) {
        NotificationHandler handler = notificationHandlers.get(method);
        if (handler == null) {
            log.debug("No handler for notification: {}", method);
            return;
        }
        try {
            handler.handle(params, session);
        } catch (Exception e) {
            log.error("Notification handler failed for {}: {}", method, e.getMessage(), e);
        }
    }
}
