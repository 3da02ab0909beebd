package com.tabrelay.gateway.session;

/**
 * How a client is connected. WebSocket and SSE sessions receive notifications as they
 * happen; HTTP sessions queue them until the client polls.
 */
public enum TransportKind {
    WEBSOCKET("websocket"),
    SSE("sse"),
    HTTP("http");

    private final String label;

    TransportKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
