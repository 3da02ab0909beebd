package com.tabrelay.gateway.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.common.error.UnknownSessionException;
import com.tabrelay.common.model.JsonRpcMessage;
import com.tabrelay.gateway.protocol.McpProtocolHandler;
import com.tabrelay.gateway.session.ClientSession;
import com.tabrelay.gateway.session.ClientSessionManager;
import com.tabrelay.gateway.session.QueuedMessageSink;
import com.tabrelay.gateway.session.TransportKind;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Stateless request/response transport at {@code /mcp}. The session id is issued
 * in a response header on initialize and must be echoed on every later request.
 * Notifications for these sessions wait in a queue until the client polls with GET.
 */
@Slf4j
public class StreamableHttpTransport {

    public static final String PATH = "/mcp";

    private final ObjectMapper mapper;
    private final ClientSessionManager sessions;
    private final McpProtocolHandler protocol;

    public StreamableHttpTransport(ObjectMapper mapper, ClientSessionManager sessions, McpProtocolHandler protocol) {
        this.mapper = mapper;
        this.sessions = sessions;
        this.protocol = protocol;
    }

    public void handle(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
        HttpMethod method = request.method();
        if (HttpMethod.POST.equals(method)) {
            post(ctx, request, keepAlive);
        } else if (HttpMethod.GET.equals(method)) {
            poll(ctx, request, keepAlive);
        } else if (HttpMethod.DELETE.equals(method)) {
            delete(ctx, request, keepAlive);
        } else {
            HttpResponses.send(ctx, keepAlive, HttpResponses.text(HttpResponseStatus.METHOD_NOT_ALLOWED,
                    "Method not allowed"));
        }
    }

    private void post(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
        JsonNode message;
        try {
            message = mapper.readTree(request.content().toString(CharsetUtil.UTF_8));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable HTTP message: {}", e.getOriginalMessage());
            HttpResponses.send(ctx, keepAlive, HttpResponses.rpcError(mapper, HttpResponseStatus.BAD_REQUEST,
                    JsonRpcMessage.PARSE_ERROR, "Parse error"));
            return;
        }

        String sessionId = request.headers().get(HttpResponses.SESSION_HEADER);
        ClientSession session;
        boolean created = false;
        if (sessionId == null || sessionId.isBlank()) {
            if (!McpProtocolHandler.isInitializeRequest(message)) {
                log.warn("HTTP request without {} header", HttpResponses.SESSION_HEADER);
                HttpResponses.send(ctx, keepAlive, missingSession());
                return;
            }
            Long timeoutMs = parseSessionTimeout(request.headers().get(HttpResponses.SESSION_TIMEOUT_HEADER));
            session = sessions.create(TransportKind.HTTP, new QueuedMessageSink(), timeoutMs);
            created = true;
        } else {
            session = lookup(ctx, sessionId, keepAlive);
            if (session == null) {
                return;
            }
        }

        boolean newSession = created;
        protocol.handle(session, message).whenComplete((response, error) -> {
            FullHttpResponse out;
            if (error != null) {
                log.error("Unhandled failure on HTTP session {}: {}", session.getId(), error.getMessage(), error);
                out = HttpResponses.rpcError(mapper, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                        JsonRpcMessage.INTERNAL_ERROR, "Internal error");
            } else if (response == null) {
                out = HttpResponses.empty(HttpResponseStatus.ACCEPTED);
            } else {
                out = HttpResponses.jsonText(HttpResponseStatus.OK, protocol.encode(response));
            }

            if (newSession && (error != null || response == null || response.getError() != null)) {
                sessions.close(session.getId());
            } else {
                out.headers().set(HttpResponses.SESSION_HEADER, session.getId());
            }
            HttpResponses.send(ctx, keepAlive, out);
        });
    }

    /**
     * Drain queued notifications as an event-stream body.
     */
    private void poll(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
        ClientSession session = requireHeader(ctx, request, keepAlive);
        if (session == null) {
            return;
        }
        List<String> queued = session.getSink() instanceof QueuedMessageSink queue ? queue.drain() : List.of();
        StringBuilder body = new StringBuilder();
        for (String json : queued) {
            body.append("event: message\ndata: ").append(json).append("\n\n");
        }
        FullHttpResponse out = HttpResponses.bytes(HttpResponseStatus.OK, HttpResponses.EVENT_STREAM,
                body.toString().getBytes(CharsetUtil.UTF_8));
        out.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        out.headers().set(HttpResponses.SESSION_HEADER, session.getId());
        log.debug("Drained {} notifications for HTTP session {}", queued.size(), session.getId());
        HttpResponses.send(ctx, keepAlive, out);
    }

    private void delete(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
        ClientSession session = requireHeader(ctx, request, keepAlive);
        if (session == null) {
            return;
        }
        sessions.close(session.getId());
        HttpResponses.send(ctx, keepAlive, HttpResponses.empty(HttpResponseStatus.OK));
    }

    private ClientSession requireHeader(ChannelHandlerContext ctx, FullHttpRequest request, boolean keepAlive) {
        String sessionId = request.headers().get(HttpResponses.SESSION_HEADER);
        if (sessionId == null || sessionId.isBlank()) {
            HttpResponses.send(ctx, keepAlive, missingSession());
            return null;
        }
        return lookup(ctx, sessionId, keepAlive);
    }

    private ClientSession lookup(ChannelHandlerContext ctx, String sessionId, boolean keepAlive) {
        try {
            ClientSession session = sessions.require(sessionId);
            if (session.getTransport() == TransportKind.HTTP) {
                return session;
            }
            log.warn("Session {} is a {} session, not HTTP", sessionId, session.getTransport().label());
        } catch (UnknownSessionException e) {
            log.debug("Unknown HTTP session {}", sessionId);
        }
        HttpResponses.send(ctx, keepAlive, HttpResponses.rpcError(mapper, HttpResponseStatus.NOT_FOUND,
                JsonRpcMessage.SESSION_NOT_FOUND, "Session not found"));
        return null;
    }

    private FullHttpResponse missingSession() {
        return HttpResponses.rpcError(mapper, HttpResponseStatus.BAD_REQUEST,
                JsonRpcMessage.MISSING_SESSION, HttpResponses.SESSION_HEADER + " header is required");
    }

    /**
     * Client-declared idle timeout. Values under 1000 are taken as seconds,
     * anything else as milliseconds; unusable values fall back to the default.
     */
    static Long parseSessionTimeout(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid {} header: {}", HttpResponses.SESSION_TIMEOUT_HEADER, header);
            return null;
        }
        if (value <= 0) {
            return null;
        }
        return value < 1000 ? value * 1000 : value;
    }
}
