package com.tabrelay.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.relay.CommandCorrelator;
import com.tabrelay.browser.relay.TabTransportManager;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.config.BrokerConfig;
import com.tabrelay.common.config.ConfigService;
import com.tabrelay.common.config.PortDefaults;
import com.tabrelay.gateway.protocol.McpProtocolHandler;
import com.tabrelay.gateway.resources.ResourceHandler;
import com.tabrelay.gateway.runtime.BrokerShutdown;
import com.tabrelay.gateway.server.BrokerHttpHandler;
import com.tabrelay.gateway.server.BrokerServer;
import com.tabrelay.gateway.server.ClientSocketTransport;
import com.tabrelay.gateway.server.DiagnosticsDocuments;
import com.tabrelay.gateway.server.ResourceHttpRoutes;
import com.tabrelay.gateway.server.SseTransport;
import com.tabrelay.gateway.server.StreamableHttpTransport;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.tools.ArgumentValidator;
import com.tabrelay.gateway.tools.BrowserLauncher;
import com.tabrelay.gateway.tools.NewTabOpener;
import com.tabrelay.gateway.tools.SystemBrowserLauncher;
import com.tabrelay.gateway.tools.TabListing;
import com.tabrelay.gateway.tools.ToolCatalog;
import com.tabrelay.gateway.tools.ToolDispatcher;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for the broker. Components are plain objects; this class
 * is the only place they meet.
 */
@Slf4j
@Configuration
public class BrokerBeanConfig {

    @Value("${tabrelay.config.path:~/.tabrelay/config.json}")
    private String configPath;

    /** Overrides the configured port when set to a valid port. */
    @Value("${tabrelay.port:0}")
    private int portOverride;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }

    @Bean
    public BrokerConfig brokerConfig(ConfigService configService) {
        BrokerConfig config = configService.loadConfig();
        if (PortDefaults.isValidPort(portOverride)) {
            log.info("Port override from properties: {}", portOverride);
            config.setPort(portOverride);
        }
        return config;
    }

    @Bean
    public ObjectMapper brokerObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock brokerClock() {
        return Clock.systemUTC();
    }

    /**
     * The broker's single event loop: accepts and serves connections and runs every timer.
     * Shut down by {@link BrokerShutdown}, not by the container.
     */
    @Bean(destroyMethod = "")
    public EventLoopGroup brokerEventLoop() {
        return new NioEventLoopGroup(1, new DefaultThreadFactory("tabrelay-loop"));
    }

    // ==================== Tab side ====================

    @Bean
    public TabRegistry tabRegistry(Clock brokerClock) {
        return new TabRegistry(brokerClock);
    }

    @Bean
    public TabTransportManager tabTransportManager(ObjectMapper brokerObjectMapper, TabRegistry tabRegistry,
                                                   BrokerConfig config) {
        return new TabTransportManager(brokerObjectMapper, tabRegistry,
                config.getHeartbeatTimeoutMs(), config.getMaxFrameBytes());
    }

    @Bean
    public CommandCorrelator commandCorrelator(TabTransportManager tabTransportManager, TabRegistry tabRegistry,
                                               EventLoopGroup brokerEventLoop) {
        CommandCorrelator correlator = new CommandCorrelator(tabTransportManager, tabRegistry, brokerEventLoop);
        tabTransportManager.setResponseHandler(correlator::handleResponse);
        return correlator;
    }

    // ==================== Tools and resources ====================

    @Bean
    public ToolCatalog toolCatalog() {
        return ToolCatalog.loadDefault();
    }

    @Bean
    public BrowserLauncher browserLauncher() {
        return new SystemBrowserLauncher();
    }

    @Bean
    public NewTabOpener newTabOpener(TabRegistry tabRegistry, BrowserLauncher browserLauncher,
                                     EventLoopGroup brokerEventLoop, BrokerConfig config) {
        return new NewTabOpener(tabRegistry, browserLauncher, brokerEventLoop,
                config.getNewTabBootstrapUrl(), config.getNewTabWaitMs(), config.getNewTabPollMs());
    }

    @Bean
    public TabListing tabListing(CommandCorrelator commandCorrelator, TabRegistry tabRegistry,
                                 ObjectMapper brokerObjectMapper, BrokerConfig config) {
        return new TabListing(commandCorrelator, tabRegistry, brokerObjectMapper,
                config.getChatClientHosts(), config.getDefaultCommandTimeoutMs());
    }

    @Bean
    public ToolDispatcher toolDispatcher(ToolCatalog toolCatalog, CommandCorrelator commandCorrelator,
                                         TabRegistry tabRegistry, TabListing tabListing, NewTabOpener newTabOpener,
                                         ObjectMapper brokerObjectMapper, BrokerConfig config) {
        return new ToolDispatcher(toolCatalog, new ArgumentValidator(), commandCorrelator, tabRegistry,
                tabListing, newTabOpener, brokerObjectMapper, config.getDefaultCommandTimeoutMs(), config.baseUrl());
    }

    @Bean
    public ResourceHandler resourceHandler(TabRegistry tabRegistry, CommandCorrelator commandCorrelator,
                                           ObjectMapper brokerObjectMapper, BrokerConfig config) {
        return new ResourceHandler(tabRegistry, commandCorrelator, brokerObjectMapper,
                config.getDefaultCommandTimeoutMs());
    }

    // ==================== Client side ====================

    @Bean
    public ClientSessionManager clientSessionManager(ObjectMapper brokerObjectMapper, TabRegistry tabRegistry,
                                                     EventLoopGroup brokerEventLoop, Clock brokerClock,
                                                     TabTransportManager tabTransportManager, BrokerConfig config) {
        ClientSessionManager sessions = new ClientSessionManager(brokerObjectMapper, tabRegistry, brokerEventLoop,
                brokerClock, config.getHttpSessionTimeoutMs(), config.getSessionSweepIntervalMs());
        tabTransportManager.setConsoleLogHandler(sessions::onConsoleLog);
        return sessions;
    }

    @Bean
    public McpProtocolHandler mcpProtocolHandler(ObjectMapper brokerObjectMapper, ClientSessionManager sessions,
                                                 ToolDispatcher toolDispatcher, ResourceHandler resourceHandler) {
        return new McpProtocolHandler(brokerObjectMapper, sessions, toolDispatcher, resourceHandler);
    }

    @Bean
    public BrokerServer brokerServer(ObjectMapper brokerObjectMapper, TabTransportManager tabTransportManager,
                                     ClientSessionManager sessions, McpProtocolHandler protocol,
                                     ResourceHandler resourceHandler, TabRegistry tabRegistry, Clock brokerClock,
                                     EventLoopGroup brokerEventLoop, BrokerConfig config) {
        ClientSocketTransport clientSockets =
                new ClientSocketTransport(sessions, protocol, config.getMaxFrameBytes());
        SseTransport sse = new SseTransport(brokerObjectMapper, sessions, protocol);
        StreamableHttpTransport streamableHttp = new StreamableHttpTransport(brokerObjectMapper, sessions, protocol);
        ResourceHttpRoutes resourceRoutes = new ResourceHttpRoutes(brokerObjectMapper, resourceHandler);
        DiagnosticsDocuments diagnostics = new DiagnosticsDocuments(sessions, tabRegistry, brokerClock);

        return new BrokerServer(config.getHost(), config.getPort(), config.getMaxFrameBytes(),
                brokerEventLoop, brokerEventLoop,
                () -> new BrokerHttpHandler(brokerObjectMapper, tabTransportManager, clientSockets, sse,
                        streamableHttp, resourceRoutes, diagnostics, config.getMaxFrameBytes()));
    }

    @Bean
    public BrokerShutdown brokerShutdown(BrokerServer brokerServer, CommandCorrelator commandCorrelator,
                                         TabTransportManager tabTransportManager, ClientSessionManager sessions,
                                         EventLoopGroup brokerEventLoop, BrokerConfig config) {
        return new BrokerShutdown(brokerServer, commandCorrelator, tabTransportManager, sessions,
                List.of(brokerEventLoop), config.getShutdownTimeoutMs());
    }
}
