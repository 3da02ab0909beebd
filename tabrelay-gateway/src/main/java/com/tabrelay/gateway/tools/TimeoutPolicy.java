package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Computes the correlator deadline for a tool call. Operations whose own duration
 * grows with their arguments get a deadline that covers it plus overhead.
 */
public final class TimeoutPolicy {

    static final long CLICK_TIMEOUT_MS = 8_000;
    static final long MIN_TIMEOUT_MS = 5_000;
    static final long WAIT_OVERHEAD_MS = 2_000;
    static final long TYPE_OVERHEAD_MS = 5_000;
    static final long DEFAULT_TYPE_DELAY_MS = 50;

    private TimeoutPolicy() {
    }

    public static long commandTimeout(String toolName, JsonNode args, long defaultTimeoutMs) {
        Long timeout = positiveLong(args, "timeout");
        switch (toolName) {
            case "click":
                return timeout != null ? timeout : CLICK_TIMEOUT_MS;
            case "wait_for_element":
                return timeout != null ? timeout + WAIT_OVERHEAD_MS : defaultTimeoutMs;
            case "type": {
                if (timeout != null) {
                    return timeout;
                }
                JsonNode text = args != null ? args.get("text") : null;
                if (text == null || !text.isTextual()) {
                    return defaultTimeoutMs;
                }
                Long delay = nonNegativeLong(args, "delay");
                long perKey = delay != null ? delay : DEFAULT_TYPE_DELAY_MS;
                return Math.max(MIN_TIMEOUT_MS, text.asText().length() * perKey + TYPE_OVERHEAD_MS);
            }
            case "keypress": {
                Long delay = positiveLong(args, "delay");
                if (delay != null && timeout == null) {
                    return Math.max(MIN_TIMEOUT_MS, delay + WAIT_OVERHEAD_MS);
                }
                return timeout != null ? timeout : defaultTimeoutMs;
            }
            default:
                return timeout != null ? timeout : defaultTimeoutMs;
        }
    }

    private static Long positiveLong(JsonNode args, String field) {
        Long value = nonNegativeLong(args, field);
        return value != null && value > 0 ? value : null;
    }

    private static Long nonNegativeLong(JsonNode args, String field) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.get(field);
        if (node == null || !node.isNumber() || node.asLong() < 0) {
            return null;
        }
        return node.asLong();
    }
}
