package com.tabrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the broker configuration from an optional JSON file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BrokerConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public BrokerConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BrokerConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private BrokerConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.info("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new BrokerConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            BrokerConfig config = objectMapper.readValue(raw, BrokerConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new BrokerConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Replace missing or nonsensical values with the built-in defaults.
     */
    BrokerConfig applyDefaults(BrokerConfig config) {
        BrokerConfig defaults = new BrokerConfig();
        if (config.getHost() == null || config.getHost().isBlank()) {
            config.setHost(defaults.getHost());
        }
        config.setPort(PortDefaults.clampPort(config.getPort(), defaults.getPort()));
        if (config.getDefaultCommandTimeoutMs() <= 0) {
            config.setDefaultCommandTimeoutMs(defaults.getDefaultCommandTimeoutMs());
        }
        if (config.getHeartbeatTimeoutMs() <= 0) {
            config.setHeartbeatTimeoutMs(defaults.getHeartbeatTimeoutMs());
        }
        if (config.getHttpSessionTimeoutMs() <= 0) {
            config.setHttpSessionTimeoutMs(defaults.getHttpSessionTimeoutMs());
        }
        if (config.getSessionSweepIntervalMs() <= 0) {
            config.setSessionSweepIntervalMs(defaults.getSessionSweepIntervalMs());
        }
        if (config.getNewTabWaitMs() <= 0) {
            config.setNewTabWaitMs(defaults.getNewTabWaitMs());
        }
        if (config.getNewTabPollMs() <= 0) {
            config.setNewTabPollMs(defaults.getNewTabPollMs());
        }
        if (config.getNewTabBootstrapUrl() == null || config.getNewTabBootstrapUrl().isBlank()) {
            config.setNewTabBootstrapUrl(defaults.getNewTabBootstrapUrl());
        }
        if (config.getChatClientHosts() == null) {
            config.setChatClientHosts(new ArrayList<>(defaults.getChatClientHosts()));
        }
        if (config.getShutdownTimeoutMs() <= 0) {
            config.setShutdownTimeoutMs(defaults.getShutdownTimeoutMs());
        }
        if (config.getMaxFrameBytes() <= 0) {
            config.setMaxFrameBytes(defaults.getMaxFrameBytes());
        }
        return config;
    }

    /**
     * Config as a plain map, for diagnostics output.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> describe() {
        return objectMapper.convertValue(loadConfig(), Map.class);
    }
}
