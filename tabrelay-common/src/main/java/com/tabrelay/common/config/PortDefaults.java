package com.tabrelay.common.config;

/**
 * Well-known broker port and port sanity checks.
 */
public final class PortDefaults {

    private PortDefaults() {
    }

    /** Fixed port shared by tab agents and protocol clients. */
    public static final int DEFAULT_BROKER_PORT = 61822;

    public static boolean isValidPort(int port) {
        return port > 0 && port <= 65535;
    }

    public static int clampPort(int port, int fallback) {
        return isValidPort(port) ? port : fallback;
    }
}
