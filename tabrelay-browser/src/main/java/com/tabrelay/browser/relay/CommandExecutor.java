package com.tabrelay.browser.relay;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a named command on a tab agent and yields the agent's result.
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * @throws com.tabrelay.common.error.TabNotConnectedException synchronously when the tab is not connected
     */
    CompletableFuture<JsonNode> execute(String tabId, String command, JsonNode params, long timeoutMs);
}
