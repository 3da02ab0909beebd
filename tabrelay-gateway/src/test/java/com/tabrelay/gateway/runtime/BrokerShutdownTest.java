package com.tabrelay.gateway.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.relay.CommandCorrelator;
import com.tabrelay.browser.relay.TabCommandSender;
import com.tabrelay.browser.relay.TabRelayTypes;
import com.tabrelay.browser.relay.TabTransportManager;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.gateway.server.BrokerServer;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.session.QueuedMessageSink;
import com.tabrelay.gateway.session.TransportKind;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BrokerShutdownTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private NioEventLoopGroup loop;
    private BrokerServer server;
    private CommandCorrelator correlator;
    private ClientSessionManager sessions;
    private BrokerShutdown shutdown;

    @BeforeEach
    void setUp() {
        loop = new NioEventLoopGroup(1);
        TabRegistry registry = new TabRegistry();
        server = new BrokerServer("127.0.0.1", 0, 65536, loop, loop, ChannelInboundHandlerAdapter::new);
        correlator = new CommandCorrelator(new TabCommandSender() {
            @Override
            public boolean isConnected(String tabId) {
                return true;
            }

            @Override
            public void sendCommand(String tabId, TabRelayTypes.CommandMessage command) {
            }
        }, registry, loop);
        TabTransportManager tabTransport = new TabTransportManager(mapper, registry, 30_000, 1 << 20);
        sessions = new ClientSessionManager(mapper, registry, loop, Clock.systemUTC(), 300_000, 60_000);
        shutdown = new BrokerShutdown(server, correlator, tabTransport, sessions, List.of(loop), 2000);
    }

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS);
    }

    @Test
    void shutdown_releasesEverything() throws Exception {
        server.start();
        sessions.start();
        assertTrue(server.isRunning());
        CompletableFuture<JsonNode> pending = correlator.execute("t1", "click", mapper.createObjectNode(), 60_000);
        ClientSession session = sessions.create(TransportKind.SSE, new QueuedMessageSink(), null);

        assertTrue(shutdown.shutdown("test"));

        assertFalse(server.isRunning());
        ExecutionException ex = assertThrows(ExecutionException.class, () -> pending.get(1, TimeUnit.SECONDS));
        assertEquals(CommandCorrelator.SHUTTING_DOWN, assertInstanceOf(BrokerException.class, ex.getCause()).getCode());
        assertEquals(0, correlator.pendingCount());
        assertTrue(session.isClosed());
        assertEquals(0, sessions.size());
        assertTrue(loop.isShuttingDown());
        assertTrue(shutdown.isShutDown());
    }

    @Test
    void shutdown_runsOnce() {
        assertTrue(shutdown.shutdown(null));
        assertFalse(shutdown.shutdown("again"));
    }

    @Test
    void shutdown_beforeStart_stillCompletes() {
        assertTrue(shutdown.shutdown("startup failed"));
        assertFalse(server.isRunning());
        assertTrue(loop.isShuttingDown());
    }
}
