package com.tabrelay.browser.tabs;

import java.time.Instant;

/**
 * One connected tab agent as seen by the registry. Instances are immutable;
 * the registry swaps in a new one on every change.
 */
public record TabSession(String tabId, TabMetadata metadata, Instant connectedAt, Instant lastPing) {

    public String url() {
        return metadata.getUrl();
    }

    public String title() {
        return metadata.getTitle();
    }

    public String browserInstanceId() {
        return metadata.getBrowserInstanceId();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(metadata.getActive());
    }

    TabSession withMetadata(TabMetadata updated) {
        return new TabSession(tabId, updated, connectedAt, lastPing);
    }

    TabSession withLastPing(Instant ping) {
        return new TabSession(tabId, metadata, connectedAt, ping);
    }
}
