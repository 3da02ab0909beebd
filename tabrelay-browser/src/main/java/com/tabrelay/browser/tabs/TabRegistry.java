package com.tabrelay.browser.tabs;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Authoritative table of connected tab agents.
 *
 * <p>Every mutation publishes a {@link TabRegistryEvent} to all subscribers,
 * synchronously and in subscription order, after the table has been changed.
 * Subscribers must not block; a failing subscriber is logged and skipped.
 */
@Slf4j
public class TabRegistry {

    private final Map<String, TabSession> tabs = new ConcurrentHashMap<>();
    private final List<Consumer<TabRegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public TabRegistry() {
        this(Clock.systemUTC());
    }

    public TabRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create or replace the session for {@code tabId}.
     */
    public TabSession register(String tabId, TabMetadata metadata) {
        Instant now = clock.instant();
        TabMetadata stored = metadata != null ? metadata.copy() : new TabMetadata();
        TabSession session = new TabSession(tabId, stored, now, now);
        TabSession previous = tabs.put(tabId, session);
        if (previous != null) {
            log.info("Tab re-registered: tabId={} url={}", tabId, stored.getUrl());
        } else {
            log.info("Tab registered: tabId={} browser={} url={}", tabId, stored.getBrowser(), stored.getUrl());
        }
        publish(new TabRegistryEvent(TabRegistryEvent.Type.CONNECTED, tabId, session));
        return session;
    }

    /**
     * Merge partial metadata into an existing session. Unknown ids are ignored.
     *
     * @return true if the session existed and was updated
     */
    public boolean update(String tabId, TabMetadata partial) {
        TabSession updated = tabs.computeIfPresent(tabId,
                (id, current) -> current.withMetadata(current.metadata().mergedWith(partial)));
        if (updated == null) {
            log.debug("Ignoring update for unknown tab: {}", tabId);
            return false;
        }
        publish(new TabRegistryEvent(TabRegistryEvent.Type.UPDATED, tabId, updated));
        return true;
    }

    /**
     * Refresh the heartbeat timestamp. Publishes nothing.
     */
    public boolean touch(String tabId) {
        Instant now = clock.instant();
        return tabs.computeIfPresent(tabId, (id, current) -> current.withLastPing(now)) != null;
    }

    public boolean remove(String tabId) {
        TabSession removed = tabs.remove(tabId);
        if (removed == null) {
            return false;
        }
        log.info("Tab disconnected: tabId={}", tabId);
        publish(new TabRegistryEvent(TabRegistryEvent.Type.DISCONNECTED, tabId, removed));
        return true;
    }

    public Optional<TabSession> get(String tabId) {
        if (tabId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tabs.get(tabId));
    }

    public boolean contains(String tabId) {
        return tabId != null && tabs.containsKey(tabId);
    }

    /**
     * All sessions, oldest connection first.
     */
    public List<TabSession> getAll() {
        List<TabSession> all = new ArrayList<>(tabs.values());
        all.sort(Comparator.comparing(TabSession::connectedAt).thenComparing(TabSession::tabId));
        return all;
    }

    /**
     * The user-focused tab, if any agent reports one. When several claim focus
     * (one per browser window) the most recently connected wins.
     */
    public Optional<TabSession> getActiveTab() {
        return tabs.values().stream()
                .filter(TabSession::isActive)
                .max(Comparator.comparing(TabSession::connectedAt).thenComparing(TabSession::tabId));
    }

    public int size() {
        return tabs.size();
    }

    /**
     * Subscribe to registry events.
     *
     * @return a handle that removes the subscription
     */
    public Runnable subscribe(Consumer<TabRegistryEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void publish(TabRegistryEvent event) {
        for (Consumer<TabRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Tab registry listener failed on {} for {}: {}",
                        event.type(), event.tabId(), e.getMessage(), e);
            }
        }
    }
}
