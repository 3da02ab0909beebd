package com.tabrelay.gateway.tools;

import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.browser.tabs.TabSession;
import com.tabrelay.browser.tabs.TabViews;
import com.tabrelay.common.error.BrokerException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opens a browser window on a tagged bootstrap page and waits for the tab it
 * creates to register. Waiting is done by polling the registry on the scheduler,
 * never by blocking a thread.
 */
@Slf4j
public class NewTabOpener {

    public static final List<String> SUPPORTED_BROWSERS = List.of("chrome", "edge", "brave", "opera", "vivaldi");

    private static final String TAG_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final TabRegistry registry;
    private final BrowserLauncher launcher;
    private final ScheduledExecutorService scheduler;
    private final String bootstrapUrl;
    private final long waitMs;
    private final long pollMs;

    public NewTabOpener(TabRegistry registry, BrowserLauncher launcher, ScheduledExecutorService scheduler,
                        String bootstrapUrl, long waitMs, long pollMs) {
        this.registry = registry;
        this.launcher = launcher;
        this.scheduler = scheduler;
        this.bootstrapUrl = bootstrapUrl;
        this.waitMs = waitMs;
        this.pollMs = pollMs;
    }

    public CompletableFuture<Map<String, Object>> open(String browser) {
        if (browser != null && !SUPPORTED_BROWSERS.contains(browser.toLowerCase(Locale.ROOT))) {
            return CompletableFuture.failedFuture(
                    new BrokerException("UNSUPPORTED_BROWSER", unsupportedBrowserMessage(browser)));
        }

        String tag = newTag();
        String url = bootstrapUrl + "?auto-connect=true#session=" + tag;
        try {
            launcher.open(url, browser);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to open browser for new tab: {}", e.getMessage(), e);
            return CompletableFuture.failedFuture(
                    new BrokerException("LAUNCH_FAILED", "Failed to open browser: " + e.getMessage(), e));
        }

        CompletableFuture<Map<String, Object>> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);
        AtomicReference<ScheduledFuture<?>> poll = new AtomicReference<>();
        poll.set(scheduler.scheduleAtFixedRate(() -> {
            if (result.isDone()) {
                return;
            }
            Optional<TabSession> tab = findTagged(tag);
            if (tab.isPresent()) {
                Map<String, Object> detail = TabViews.detail(tab.get());
                detail.put("success", true);
                log.info("New tab connected: tabId={} tag={}", tab.get().tabId(), tag);
                result.complete(detail);
            } else if (System.nanoTime() - deadline >= 0) {
                log.warn("New tab with tag {} did not connect within {}ms", tag, waitMs);
                result.completeExceptionally(new BrokerException("NEW_TAB_TIMEOUT",
                        "New tab failed to connect within timeout. Make sure the TabRelay extension is installed."));
            }
        }, pollMs, pollMs, TimeUnit.MILLISECONDS));
        result.whenComplete((r, e) -> {
            ScheduledFuture<?> task = poll.get();
            if (task != null) {
                task.cancel(false);
            }
        });
        return result;
    }

    private Optional<TabSession> findTagged(String tag) {
        String marker = "session=" + tag;
        return registry.getAll().stream()
                .filter(t -> t.url() != null && t.url().contains(marker))
                .findFirst();
    }

    static String newTag() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder tag = new StringBuilder().append(System.currentTimeMillis()).append('-');
        for (int i = 0; i < 7; i++) {
            tag.append(TAG_ALPHABET.charAt(random.nextInt(TAG_ALPHABET.length())));
        }
        return tag.toString();
    }

    static String unsupportedBrowserMessage(String browser) {
        return "Unsupported browser: " + browser + ". Supported browsers: " + String.join(", ", SUPPORTED_BROWSERS);
    }
}
