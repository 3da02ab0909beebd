package com.tabrelay.browser.tabs;

/**
 * Published by {@link TabRegistry} after each mutation. For disconnects {@code tab}
 * holds the session as it was just before removal.
 */
public record TabRegistryEvent(Type type, String tabId, TabSession tab) {

    public enum Type {
        CONNECTED,
        UPDATED,
        DISCONNECTED
    }
}
