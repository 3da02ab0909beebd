package com.tabrelay.gateway.server;

import com.tabrelay.common.error.BrokerStartupException;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.function.Supplier;

/**
 * The single listening port shared by tab agents and protocol clients.
 */
@Slf4j
public class BrokerServer {

    @Getter
    private final String host;
    private final int port;
    private final int maxContentBytes;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Supplier<ChannelHandler> handlerFactory;

    private volatile Channel serverChannel;

    public BrokerServer(String host, int port, int maxContentBytes, EventLoopGroup bossGroup,
                        EventLoopGroup workerGroup, Supplier<ChannelHandler> handlerFactory) {
        this.host = host;
        this.port = port;
        this.maxContentBytes = maxContentBytes;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
        this.handlerFactory = handlerFactory;
    }

    /**
     * Bind the port. Nothing is accepted before this returns.
     *
     * @throws BrokerStartupException if the port cannot be bound
     */
    public synchronized void start() {
        if (serverChannel != null) {
            log.debug("Broker server already running");
            return;
        }
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(maxContentBytes),
                                handlerFactory.get());
                    }
                });
        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerStartupException("Interrupted while binding " + host + ":" + port, e);
        } catch (Exception e) {
            log.error("Broker failed to bind {}:{}: {}", host, port, e.getMessage());
            throw new BrokerStartupException("Failed to bind " + host + ":" + port
                    + " (is another broker already running?)", e);
        }
        log.info("Broker listening on http://{}:{}/ (tab agents: ws, clients: ws /mcp, sse /sse, http /mcp)",
                host, getPort());
    }

    /**
     * Close the listening socket. Open connections are left to their owners.
     */
    public synchronized void stopAccepting() {
        Channel channel = serverChannel;
        serverChannel = null;
        if (channel != null) {
            channel.close().awaitUninterruptibly();
            log.info("Broker stopped accepting connections");
        }
    }

    public boolean isRunning() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel != null && channel.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }
}
