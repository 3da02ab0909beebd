package com.tabrelay.gateway.server;

import com.tabrelay.gateway.protocol.McpProtocolHandler;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.session.MessageSink;
import com.tabrelay.gateway.session.TransportKind;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import lombok.extern.slf4j.Slf4j;

/**
 * Client sessions over a persistent WebSocket at {@code /mcp}: one JSON-RPC
 * message per text frame, and the session lives exactly as long as the channel.
 */
@Slf4j
public class ClientSocketTransport {

    public static final String PATH = "/mcp";

    private final ClientSessionManager sessions;
    private final McpProtocolHandler protocol;
    private final int maxFrameBytes;

    public ClientSocketTransport(ClientSessionManager sessions, McpProtocolHandler protocol, int maxFrameBytes) {
        this.sessions = sessions;
        this.protocol = protocol;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Open a session for a channel whose handshake has completed and install the frame handlers.
     */
    public ClientSession attach(ChannelPipeline pipeline) {
        Channel channel = pipeline.channel();
        ClientSession session = sessions.create(TransportKind.WEBSOCKET, new WebSocketSink(channel), null);
        pipeline.addLast("client-aggregator", new WebSocketFrameAggregator(maxFrameBytes));
        pipeline.addLast("client-socket", new ClientSocketHandler(session));
        return session;
    }

    private static final class WebSocketSink implements MessageSink {

        private final Channel channel;

        private WebSocketSink(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(String json) {
            if (!channel.isActive()) {
                throw new IllegalStateException("WebSocket closed");
            }
            channel.writeAndFlush(new TextWebSocketFrame(json));
        }

        @Override
        public void close() {
            if (channel.isActive()) {
                channel.writeAndFlush(new CloseWebSocketFrame(1001, "server closing"))
                        .addListener(ChannelFutureListener.CLOSE);
            }
        }
    }

    private class ClientSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

        private final ClientSession session;

        private ClientSocketHandler(ClientSession session) {
            this.session = session;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof CloseWebSocketFrame) {
                ctx.writeAndFlush(frame.retainedDuplicate()).addListener(ChannelFutureListener.CLOSE);
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            if (!(frame instanceof TextWebSocketFrame textFrame)) {
                log.debug("Ignoring non-text frame from client session {}", session.getId());
                return;
            }
            protocol.handleText(session, textFrame.text()).whenComplete((response, error) -> {
                if (error != null) {
                    log.error("Unhandled failure on client session {}: {}", session.getId(), error.getMessage(), error);
                } else if (response != null) {
                    session.send(protocol.encode(response));
                }
            });
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            sessions.close(session.getId());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Client socket error on session {}: {}", session.getId(), cause.getMessage());
            ctx.close();
        }
    }
}
