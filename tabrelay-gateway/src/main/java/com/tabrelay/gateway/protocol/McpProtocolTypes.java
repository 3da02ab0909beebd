package com.tabrelay.gateway.protocol;

import java.util.List;

/**
 * Method names, notification names and version constants of the client protocol.
 */
public final class McpProtocolTypes {

    private McpProtocolTypes() {
    }

    public static final String SERVER_NAME = "tabrelay";
    public static final String SERVER_VERSION = "0.1.0";

    /** Newest first. */
    public static final List<String> SUPPORTED_VERSIONS = List.of("2025-06-18", "2025-03-26", "2024-11-05");
    public static final String LATEST_VERSION = SUPPORTED_VERSIONS.get(0);

    // ==================== Methods ====================

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "notifications/initialized";
    public static final String PING = "ping";
    public static final String TOOLS_LIST = "tools/list";
    public static final String TOOLS_CALL = "tools/call";
    public static final String RESOURCES_LIST = "resources/list";
    public static final String RESOURCES_READ = "resources/read";

    // ==================== Notifications ====================

    public static final String RESOURCES_LIST_CHANGED = "notifications/resources/list_changed";
    public static final String TABS_CHANGED = "tabrelay/tabs_changed";
    public static final String TAB_DISCONNECTED = "tabrelay/tab_disconnected";
    public static final String CONSOLE_LOG = "tabrelay/console_log";

    /**
     * The client's requested version if supported, otherwise the newest one.
     */
    public static String negotiateVersion(String requested) {
        return requested != null && SUPPORTED_VERSIONS.contains(requested) ? requested : LATEST_VERSION;
    }
}
