package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ToolCatalogTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void loadDefault_declaresEveryTool() {
        ToolCatalog catalog = ToolCatalog.loadDefault();
        Set<String> names = catalog.list().stream().map(ToolDefinition::getName).collect(Collectors.toSet());

        assertEquals(30, catalog.size());
        assertTrue(names.containsAll(List.of("list_tabs", "new_tab", "get_active_tab", "tab_detail", "navigate",
                "click", "type", "keypress", "screenshot", "wait_for_element", "console_logs", "accessibility_tree")));
    }

    @Test
    void remoteCommand_defaultsToToolName() {
        ToolCatalog catalog = ToolCatalog.loadDefault();
        assertEquals("getLogs", catalog.find("console_logs").orElseThrow().remoteCommand());
        assertEquals("click", catalog.find("click").orElseThrow().remoteCommand());
    }

    @Test
    void tabTools_requireTabId() {
        ToolCatalog catalog = ToolCatalog.loadDefault();
        Set<String> registryTools = Set.of("list_tabs", "new_tab", "get_active_tab");
        for (ToolDefinition tool : catalog.list()) {
            boolean requiresTab = false;
            for (JsonNode required : tool.getInputSchema().path("required")) {
                requiresTab |= "tabId".equals(required.asText());
            }
            assertEquals(!registryTools.contains(tool.getName()), requiresTab, tool.getName());
        }
    }

    @Test
    void serializedDefinition_hidesRemoteCommand() throws Exception {
        ToolDefinition tool = ToolCatalog.loadDefault().find("console_logs").orElseThrow();
        JsonNode json = mapper.valueToTree(tool);

        assertEquals("console_logs", json.get("name").asText());
        assertTrue(json.has("inputSchema"));
        assertFalse(json.has("command"));
    }

    @Test
    void duplicateNames_rejected() {
        ToolDefinition a = ToolDefinition.builder().name("dup").build();
        ToolDefinition b = ToolDefinition.builder().name("dup").build();
        assertThrows(IllegalArgumentException.class, () -> new ToolCatalog(List.of(a, b)));
    }

    @Test
    void find_unknownOrNull_empty() {
        ToolCatalog catalog = ToolCatalog.loadDefault();
        assertTrue(catalog.find("nope").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
    }
}
