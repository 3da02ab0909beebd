package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static tool declarations, loaded once from {@code tools.yaml} on the classpath.
 */
@Slf4j
public class ToolCatalog {

    public static final String DEFAULT_RESOURCE = "tools.yaml";

    private final Map<String, ToolDefinition> tools;

    public ToolCatalog(List<ToolDefinition> definitions) {
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition tool : definitions) {
            if (byName.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool declaration: " + tool.getName());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public static ToolCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static ToolCatalog load(String resource) {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream in = ToolCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Tool catalog not found on classpath: " + resource);
            }
            CatalogFile file = yaml.readValue(in, CatalogFile.class);
            ToolCatalog catalog = new ToolCatalog(file.getTools() != null ? file.getTools() : List.of());
            log.info("Loaded {} tool declarations from {}", catalog.size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tool catalog " + resource, e);
        }
    }

    public List<ToolDefinition> list() {
        return new ArrayList<>(tools.values());
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    public int size() {
        return tools.size();
    }

    @Data
    @NoArgsConstructor
    static class CatalogFile {
        private List<ToolDefinition> tools;
    }
}
