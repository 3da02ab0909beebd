package com.tabrelay.gateway.session;

public enum SessionState {
    CREATED,
    INITIALIZING,
    INITIALIZED,
    CLOSED;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
