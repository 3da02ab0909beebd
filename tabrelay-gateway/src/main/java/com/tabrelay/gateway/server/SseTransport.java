package com.tabrelay.gateway.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.common.error.UnknownSessionException;
import com.tabrelay.common.model.JsonRpcMessage;
import com.tabrelay.gateway.protocol.McpProtocolHandler;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.session.MessageSink;
import com.tabrelay.gateway.session.TransportKind;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Push-only event stream paired with a POST path. The stream's first event tells
 * the client where to post; every response is pushed back as a {@code message} event.
 */
@Slf4j
public class SseTransport {

    public static final String STREAM_PATH = "/sse";
    public static final String MESSAGES_PATH = "/messages";

    private final ObjectMapper mapper;
    private final ClientSessionManager sessions;
    private final McpProtocolHandler protocol;

    public SseTransport(ObjectMapper mapper, ClientSessionManager sessions, McpProtocolHandler protocol) {
        this.mapper = mapper;
        this.sessions = sessions;
        this.protocol = protocol;
    }

    /**
     * Start the event stream on this connection. The channel stays open until the
     * client goes away, which ends the session.
     */
    public ClientSession open(ChannelHandlerContext ctx) {
        Channel channel = ctx.channel();
        HttpResponse response = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpResponses.EVENT_STREAM);
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        HttpUtil.setTransferEncodingChunked(response, true);
        HttpResponses.applyCors(response.headers());
        channel.write(response);

        ClientSession session = sessions.create(TransportKind.SSE, new EventStreamSink(channel), null);
        channel.writeAndFlush(event("endpoint", MESSAGES_PATH + "?sessionId=" + session.getId()));
        channel.closeFuture().addListener(f -> sessions.close(session.getId()));
        return session;
    }

    /**
     * A client-to-server message for an open stream. Answered with 202 at once;
     * the JSON-RPC response travels on the stream.
     */
    public void post(ChannelHandlerContext ctx, FullHttpRequest request, QueryStringDecoder decoder, boolean keepAlive) {
        List<String> ids = decoder.parameters().get("sessionId");
        String sessionId = ids != null && !ids.isEmpty() ? ids.get(0) : null;
        if (sessionId == null || sessionId.isBlank()) {
            log.warn("Event-stream message without sessionId");
            HttpResponses.send(ctx, keepAlive,
                    HttpResponses.json(mapper, HttpResponseStatus.BAD_REQUEST, Map.of("error", "Missing sessionId")));
            return;
        }

        ClientSession session;
        try {
            session = sessions.require(sessionId);
        } catch (UnknownSessionException e) {
            HttpResponses.send(ctx, keepAlive, sessionNotFound(sessionId));
            return;
        }
        if (session.getTransport() != TransportKind.SSE) {
            log.warn("Session {} is not an event-stream session", sessionId);
            HttpResponses.send(ctx, keepAlive, sessionNotFound(sessionId));
            return;
        }

        String body = request.content().toString(CharsetUtil.UTF_8);
        HttpResponses.send(ctx, keepAlive, HttpResponses.text(HttpResponseStatus.ACCEPTED, "Accepted"));

        protocol.handleText(session, body).whenComplete((response, error) -> {
            if (error != null) {
                log.error("Unhandled failure on event-stream session {}: {}", sessionId, error.getMessage(), error);
            } else if (response != null) {
                session.send(protocol.encode(response));
            }
        });
    }

    private FullHttpResponse sessionNotFound(String sessionId) {
        return HttpResponses.json(mapper, HttpResponseStatus.NOT_FOUND, JsonRpcMessage.Response.error(null,
                JsonRpcMessage.SESSION_NOT_FOUND, "Session not found", Map.of("sessionId", sessionId)));
    }

    static HttpContent event(String name, String data) {
        String frame = "event: " + name + "\ndata: " + data + "\n\n";
        return new DefaultHttpContent(Unpooled.copiedBuffer(frame, CharsetUtil.UTF_8));
    }

    private static final class EventStreamSink implements MessageSink {

        private final Channel channel;

        private EventStreamSink(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(String json) {
            if (!channel.isActive()) {
                throw new IllegalStateException("Event stream closed");
            }
            channel.writeAndFlush(event("message", json));
        }

        @Override
        public void close() {
            if (channel.isActive()) {
                channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}
