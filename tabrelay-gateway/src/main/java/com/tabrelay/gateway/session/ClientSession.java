package com.tabrelay.gateway.session;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Protocol state of one client, independent of how it is connected.
 * Lifecycle: created → initializing → initialized → closed.
 */
@Slf4j
@Getter
public class ClientSession {

    private final String id;
    private final TransportKind transport;
    private final MessageSink sink;
    private final Instant createdAt;
    /** Idle timeout requested by the client, or null for the process default. */
    private final Long timeoutMs;

    private volatile Instant lastActivity;
    private volatile SessionState state = SessionState.CREATED;
    private volatile String protocolVersion;
    private volatile ClientInfo clientInfo;

    public ClientSession(String id, TransportKind transport, MessageSink sink, Instant createdAt, Long timeoutMs) {
        this.id = id;
        this.transport = transport;
        this.sink = sink;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
        this.timeoutMs = timeoutMs;
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    /**
     * Record the outcome of an initialize request.
     */
    public void beginInitialize(String negotiatedVersion, ClientInfo info) {
        if (state == SessionState.CLOSED) {
            return;
        }
        protocolVersion = negotiatedVersion;
        clientInfo = info;
        state = SessionState.INITIALIZING;
    }

    /**
     * Handle the client's initialized acknowledgment.
     *
     * @return true if this call moved the session to initialized
     */
    public boolean completeInitialize() {
        if (state != SessionState.INITIALIZING) {
            return false;
        }
        state = SessionState.INITIALIZED;
        return true;
    }

    public boolean isInitialized() {
        return state == SessionState.INITIALIZED;
    }

    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    /**
     * @return false when the session is closed or the transport refused the message
     */
    public boolean send(String json) {
        if (state == SessionState.CLOSED) {
            return false;
        }
        try {
            sink.send(json);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to deliver message to session {}: {}", id, e.getMessage());
            return false;
        }
    }

    public boolean isExpired(Instant now, long defaultTimeoutMs) {
        long limit = timeoutMs != null ? timeoutMs : defaultTimeoutMs;
        return now.toEpochMilli() - lastActivity.toEpochMilli() > limit;
    }

    void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSED;
        sink.close();
    }
}
