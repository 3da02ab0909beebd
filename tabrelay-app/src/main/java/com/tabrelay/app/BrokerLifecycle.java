package com.tabrelay.app;

import com.tabrelay.common.config.BrokerConfig;
import com.tabrelay.common.config.ConfigService;
import com.tabrelay.common.error.BrokerStartupException;
import com.tabrelay.gateway.runtime.BrokerShutdown;
import com.tabrelay.gateway.server.BrokerServer;
import com.tabrelay.gateway.session.ClientSessionManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Starts the broker with the application context and stops it with the context.
 *
 * <p>A bind failure propagates out of {@link #start()} and fails the context, so the
 * process exits before accepting any work. Shutdown is bounded: if the graceful path
 * has not finished within the configured timeout the JVM is halted.
 */
@Slf4j
@Component
public class BrokerLifecycle {

    private final BrokerServer server;
    private final ClientSessionManager sessions;
    private final BrokerShutdown shutdown;
    private final BrokerConfig config;
    private final ConfigService configService;

    public BrokerLifecycle(BrokerServer server, ClientSessionManager sessions, BrokerShutdown shutdown,
                           BrokerConfig config, ConfigService configService) {
        this.server = server;
        this.sessions = sessions;
        this.shutdown = shutdown;
        this.config = config;
        this.configService = configService;
    }

    @PostConstruct
    public void start() {
        log.info("Starting tabrelay broker on {}:{} (config file: {})",
                config.getHost(), config.getPort(), configService.getConfigPath());
        log.debug("Effective config: {}", configService.describe());
        try {
            server.start();
        } catch (BrokerStartupException e) {
            shutdown.shutdown("startup failed");
            throw e;
        }
        sessions.start();
    }

    @PreDestroy
    public void stop() {
        Thread watchdog = new Thread(() -> {
            try {
                Thread.sleep(config.getShutdownTimeoutMs());
            } catch (InterruptedException e) {
                return;
            }
            log.error("Shutdown timeout after {}ms, forcing exit", config.getShutdownTimeoutMs());
            Runtime.getRuntime().halt(1);
        }, "tabrelay-shutdown-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();
        try {
            shutdown.shutdown("application context closing");
        } finally {
            watchdog.interrupt();
        }
    }

    public int getPort() {
        return server.getPort();
    }
}
