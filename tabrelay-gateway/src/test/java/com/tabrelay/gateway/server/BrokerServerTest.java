package com.tabrelay.gateway.server;

import com.tabrelay.common.error.BrokerStartupException;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BrokerServerTest {

    private NioEventLoopGroup loop;

    @BeforeEach
    void setUp() {
        loop = new NioEventLoopGroup(1);
    }

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS).awaitUninterruptibly();
    }

    private BrokerServer server(int port) {
        return new BrokerServer("127.0.0.1", port, 65536, loop, loop, ChannelInboundHandlerAdapter::new);
    }

    @Test
    void start_bindsEphemeralPort() {
        BrokerServer server = server(0);
        assertFalse(server.isRunning());

        server.start();

        assertTrue(server.isRunning());
        assertTrue(server.getPort() > 0);
        server.stopAccepting();
        assertFalse(server.isRunning());
    }

    @Test
    void start_portInUse_failsFast() {
        BrokerServer first = server(0);
        first.start();
        try {
            BrokerServer second = server(first.getPort());
            BrokerStartupException ex = assertThrows(BrokerStartupException.class, second::start);
            assertTrue(ex.getMessage().contains(String.valueOf(first.getPort())));
            assertFalse(second.isRunning());
        } finally {
            first.stopAccepting();
        }
    }

    @Test
    void stopAccepting_isIdempotent() {
        BrokerServer server = server(0);
        server.start();
        server.stopAccepting();
        server.stopAccepting();
        assertFalse(server.isRunning());
    }
}
