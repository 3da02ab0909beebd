package com.tabrelay.gateway.session;

/**
 * Delivers serialized JSON-RPC messages to one client over its transport.
 */
public interface MessageSink {

    void send(String json);

    /**
     * Release the underlying transport. Called once when the session closes.
     */
    default void close() {
    }
}
