package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.tabrelay.browser.tabs.TabMetadata;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.error.CommandTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TabListingTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private TabRegistry registry;
    private FakeExecutor executor;
    private TabListing listing;

    @BeforeEach
    void setUp() {
        registry = new TabRegistry();
        executor = new FakeExecutor();
        listing = new TabListing(executor, registry, mapper, List.of("chatgpt.com", "claude.ai"), 1000);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> tabs(Map<String, Object> result) {
        return (List<Map<String, Object>>) result.get("tabs");
    }

    @Test
    void list_queriesOneTabPerInstance() throws Exception {
        registry.register("b1:7", TabMetadata.builder().browserInstanceId("b1").url("https://example.com").build());
        registry.register("b1:9", TabMetadata.builder().browserInstanceId("b1").url("https://example.org").build());
        ArrayNode all = mapper.createArrayNode();
        all.addObject().put("id", "7").put("url", "https://example.com").put("title", "Example").put("active", true);
        all.addObject().put("id", "8").put("url", "https://chatgpt.com/c/1").put("title", "Chat");
        executor.reply(all);

        Map<String, Object> result = listing.list().get(1, TimeUnit.SECONDS);

        assertEquals(1, executor.calls.size());
        assertEquals("getAllTabs", executor.calls.get(0).command());
        List<Map<String, Object>> tabs = tabs(result);
        assertEquals(2, tabs.size());

        Map<String, Object> first = tabs.get(0);
        assertEquals("b1:7", first.get("tabId"));
        assertEquals(true, first.get("connected"));
        assertEquals(true, first.get("safeForAutomation"));
        assertFalse(first.containsKey("rawId"));

        Map<String, Object> chat = tabs.get(1);
        assertEquals("b1:8", chat.get("tabId"));
        assertEquals(false, chat.get("connected"));
        assertEquals(false, chat.get("safeForAutomation"));

        assertEquals("Some tabs belong to chat clients and must not be automated. Use tab b1:7 (Example) instead.",
                result.get("hint"));
    }

    @Test
    void list_queryFailure_fallsBackToRegistry() throws Exception {
        registry.register("t1", TabMetadata.builder().url("https://example.com").title("Ex").build());
        executor.fail(new CommandTimeoutException("getAllTabs", "Command getAllTabs timed out", 1000));

        Map<String, Object> result = listing.list().get(1, TimeUnit.SECONDS);

        List<Map<String, Object>> tabs = tabs(result);
        assertEquals(1, tabs.size());
        assertEquals("t1", tabs.get(0).get("tabId"));
        assertEquals(true, tabs.get(0).get("connected"));
        assertFalse(result.containsKey("hint"));
    }

    @Test
    void list_nothingConnected_hintsNewTab() throws Exception {
        Map<String, Object> result = listing.list().get(1, TimeUnit.SECONDS);

        assertTrue(tabs(result).isEmpty());
        assertEquals(TabListing.NO_TABS_HINT, result.get("hint"));
        assertTrue(executor.calls.isEmpty());
    }

    @Test
    void isSafeForAutomation_matchesHostAndSubdomains() {
        assertFalse(listing.isSafeForAutomation("https://chatgpt.com/c/abc"));
        assertFalse(listing.isSafeForAutomation("https://www.CLAUDE.ai/chat"));
        assertTrue(listing.isSafeForAutomation("https://notchatgpt.com/"));
        assertTrue(listing.isSafeForAutomation("about:blank"));
        assertTrue(listing.isSafeForAutomation(null));
        assertTrue(listing.isSafeForAutomation("not a url"));
    }
}
