package com.tabrelay.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the broker process.
 * Every field has a usable default so a missing config file is not an error.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrokerConfig {

    /** Interface the HTTP/WebSocket listener binds to. */
    private String host = "localhost";

    private int port = PortDefaults.DEFAULT_BROKER_PORT;

    /** Deadline for a tab command when neither the tool nor the caller overrides it. */
    private long defaultCommandTimeoutMs = 5_000;

    /** A tab agent connection silent for this long is dropped. */
    private long heartbeatTimeoutMs = 90_000;

    /** Idle timeout for stateless-request sessions unless the client negotiates one. */
    private long httpSessionTimeoutMs = 30 * 60 * 1000L;

    private long sessionSweepIntervalMs = 60_000;

    /** How long new_tab waits for the freshly opened tab to register. */
    private long newTabWaitMs = 15_000;

    private long newTabPollMs = 500;

    /** Page the browser extension auto-connects from when opened by new_tab. */
    private String newTabBootstrapUrl = "https://tabrelay.github.io/connect.html";

    /** Hostnames of chat clients that automation must not take over. */
    private List<String> chatClientHosts = new ArrayList<>(List.of(
            "chatgpt.com", "chat.openai.com", "openai.com", "claude.ai", "gemini.google.com"));

    /** Hard bound on graceful shutdown before the process halts. */
    private long shutdownTimeoutMs = 5_000;

    /** Largest HTTP body or WebSocket frame accepted from either side. */
    private int maxFrameBytes = 10 * 1024 * 1024;

    /**
     * Base URL clients can use to reach the HTTP endpoints of this broker.
     */
    public String baseUrl() {
        return "http://" + host + ":" + port;
    }
}
