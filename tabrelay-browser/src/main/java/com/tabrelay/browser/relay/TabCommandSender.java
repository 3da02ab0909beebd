package com.tabrelay.browser.relay;

/**
 * Delivers command envelopes to tab agents.
 */
public interface TabCommandSender {

    boolean isConnected(String tabId);

    /**
     * Write a command to the tab's connection.
     *
     * @throws com.tabrelay.common.error.TabNotConnectedException if the tab has no live connection
     */
    void sendCommand(String tabId, TabRelayTypes.CommandMessage command);
}
