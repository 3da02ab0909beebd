package com.tabrelay.browser.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.browser.tabs.TabMetadata;
import com.tabrelay.browser.tabs.TabRegistry;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.TabNotConnectedException;
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
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the WebSocket connections of tab agents.
 *
 * <p>Registration messages become {@link TabRegistry} entries, responses go to the
 * response handler, console events to the console handler. A channel that closes or
 * stays silent past the heartbeat timeout takes its tab out of the registry.
 */
@Slf4j
public class TabTransportManager implements TabCommandSender {

    static final AttributeKey<String> TAB_ID = AttributeKey.valueOf("tabrelay.tabId");

    private final ObjectMapper mapper;
    private final TabRegistry registry;
    private final long heartbeatTimeoutMs;
    private final int maxFrameBytes;
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    private volatile Consumer<TabRelayTypes.ResponseMessage> responseHandler = response -> {
    };
    private volatile ConsoleLogHandler consoleLogHandler = (tabId, logEntry) -> {
    };

    /**
     * Receives console output forwarded by a tab agent.
     */
    @FunctionalInterface
    public interface ConsoleLogHandler {
        void onConsoleLog(String tabId, JsonNode logEntry);
    }

    public TabTransportManager(ObjectMapper mapper, TabRegistry registry, long heartbeatTimeoutMs, int maxFrameBytes) {
        this.mapper = mapper;
        this.registry = registry;
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
        this.maxFrameBytes = maxFrameBytes;
    }

    public void setResponseHandler(Consumer<TabRelayTypes.ResponseMessage> responseHandler) {
        this.responseHandler = responseHandler;
    }

    public void setConsoleLogHandler(ConsoleLogHandler consoleLogHandler) {
        this.consoleLogHandler = consoleLogHandler;
    }

    /**
     * Install the tab agent handlers on a channel whose WebSocket handshake has completed.
     */
    public void attach(ChannelPipeline pipeline) {
        pipeline.addLast("tab-idle", new IdleStateHandler(heartbeatTimeoutMs, 0, 0, TimeUnit.MILLISECONDS));
        pipeline.addLast("tab-aggregator", new WebSocketFrameAggregator(maxFrameBytes));
        pipeline.addLast("tab-agent", new TabAgentHandler());
        log.info("tab agent connect: remote={}", pipeline.channel().remoteAddress());
    }

    @Override
    public boolean isConnected(String tabId) {
        if (tabId == null) {
            return false;
        }
        Channel channel = channels.get(tabId);
        return channel != null && channel.isActive();
    }

    @Override
    public void sendCommand(String tabId, TabRelayTypes.CommandMessage command) {
        Channel channel = tabId != null ? channels.get(tabId) : null;
        if (channel == null || !channel.isActive()) {
            throw new TabNotConnectedException(tabId);
        }
        String json;
        try {
            json = mapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new BrokerException("SEND_FAILED", "Failed to encode command " + command.getCommand(), e);
        }
        channel.writeAndFlush(new TextWebSocketFrame(json)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to send {} to tab {}: {}", command.getCommand(), tabId,
                        f.cause() != null ? f.cause().getMessage() : "unknown");
            }
        });
    }

    public int connectedCount() {
        return channels.size();
    }

    /**
     * Close every tab agent connection.
     */
    public void closeAll() {
        List<Channel> open = new ArrayList<>(channels.values());
        for (Channel channel : open) {
            channel.close();
        }
        if (!open.isEmpty()) {
            log.info("Closed {} tab agent connections", open.size());
        }
    }

    // ==================== Inbound handling ====================

    private void reply(Channel channel, Object envelope) {
        try {
            channel.writeAndFlush(new TextWebSocketFrame(mapper.writeValueAsString(envelope)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode reply to tab agent {}: {}", channel.remoteAddress(), e.getOriginalMessage());
        }
    }

    void handleMessage(Channel channel, String text) {
        JsonNode msg;
        try {
            msg = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Malformed message from tab agent {}: {}", channel.remoteAddress(), e.getOriginalMessage());
            return;
        }
        if (msg == null || !msg.isObject()) {
            log.debug("Ignoring non-object tab message");
            return;
        }
        String type = msg.path("type").asText("");
        String tabId = channel.attr(TAB_ID).get();

        switch (type) {
            case TabRelayTypes.TYPE_REGISTER -> handleRegister(channel, (ObjectNode) msg);
            case TabRelayTypes.TYPE_RESPONSE -> handleResponse(msg);
            case TabRelayTypes.TYPE_CONSOLE, TabRelayTypes.TYPE_CONSOLE_LOG -> handleConsole(tabId, (ObjectNode) msg);
            case TabRelayTypes.TYPE_PING -> {
                if (tabId != null) {
                    registry.touch(tabId);
                }
                reply(channel, new TabRelayTypes.PongMessage());
            }
            case TabRelayTypes.TYPE_TAB_INFO -> {
                if (tabId == null) {
                    log.debug("tabInfo before register from {}", channel.remoteAddress());
                    return;
                }
                registry.update(tabId, toMetadata(msg));
            }
            default -> log.debug("Unhandled tab message type '{}' from tab {}", type, tabId);
        }
    }

    private void handleRegister(Channel channel, ObjectNode msg) {
        String tabId = msg.path("tabId").asText("");
        if (tabId.isEmpty()) {
            log.warn("Register without tabId from {}", channel.remoteAddress());
            return;
        }

        String previousId = channel.attr(TAB_ID).getAndSet(tabId);
        if (previousId != null && !previousId.equals(tabId) && channels.remove(previousId, channel)) {
            registry.remove(previousId);
        }

        Channel displaced = channels.put(tabId, channel);
        registry.register(tabId, toMetadata(msg));
        if (displaced != null && displaced != channel) {
            log.info("Tab {} re-registered from a new connection; closing the old one", tabId);
            displaced.close();
        }
    }

    private void handleResponse(JsonNode msg) {
        try {
            responseHandler.accept(mapper.treeToValue(msg, TabRelayTypes.ResponseMessage.class));
        } catch (JsonProcessingException e) {
            log.warn("Malformed command response: {}", e.getOriginalMessage());
        }
    }

    private void handleConsole(String tabId, ObjectNode msg) {
        if (tabId == null) {
            log.debug("Console event before register");
            return;
        }
        JsonNode logEntry;
        if (msg.has("logEntry")) {
            logEntry = msg.get("logEntry");
        } else {
            ObjectNode copy = msg.deepCopy();
            copy.remove("type");
            logEntry = copy;
        }
        consoleLogHandler.onConsoleLog(tabId, logEntry);
    }

    private TabMetadata toMetadata(JsonNode msg) {
        try {
            return mapper.treeToValue(msg, TabMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable tab metadata: {}", e.getOriginalMessage());
            return new TabMetadata();
        }
    }

    void onChannelClosed(Channel channel) {
        String tabId = channel.attr(TAB_ID).get();
        if (tabId == null) {
            log.info("tab agent disconnect: remote={} (never registered)", channel.remoteAddress());
            return;
        }
        if (channels.remove(tabId, channel)) {
            registry.remove(tabId);
        }
        log.info("tab agent disconnect: tabId={} remote={}", tabId, channel.remoteAddress());
    }

    // ==================== Channel handler ====================

    private class TabAgentHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

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
            if (frame instanceof TextWebSocketFrame textFrame) {
                handleMessage(ctx.channel(), textFrame.text());
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
                log.warn("Tab {} missed heartbeat for {}ms, closing", ctx.channel().attr(TAB_ID).get(),
                        heartbeatTimeoutMs);
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            onChannelClosed(ctx.channel());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Tab agent channel error ({}): {}", ctx.channel().attr(TAB_ID).get(), cause.getMessage());
            ctx.close();
        }
    }
}
