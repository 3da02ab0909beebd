package com.tabrelay.gateway.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.browser.relay.TabTransportManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Per-connection router for the broker port. WebSocket upgrades hand the channel
 * to the client or tab transport; everything else is answered over HTTP.
 *
 * <p>Upgrades at {@code /mcp} are protocol clients. Any other upgrade path is a tab agent.
 */
@Slf4j
public class BrokerHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final ObjectMapper mapper;
    private final TabTransportManager tabTransport;
    private final ClientSocketTransport clientSockets;
    private final SseTransport sse;
    private final StreamableHttpTransport streamableHttp;
    private final ResourceHttpRoutes resourceRoutes;
    private final DiagnosticsDocuments diagnostics;
    private final int maxFrameBytes;

    public BrokerHttpHandler(ObjectMapper mapper, TabTransportManager tabTransport,
                             ClientSocketTransport clientSockets, SseTransport sse,
                             StreamableHttpTransport streamableHttp, ResourceHttpRoutes resourceRoutes,
                             DiagnosticsDocuments diagnostics, int maxFrameBytes) {
        this.mapper = mapper;
        this.tabTransport = tabTransport;
        this.clientSockets = clientSockets;
        this.sse = sse;
        this.streamableHttp = streamableHttp;
        this.resourceRoutes = resourceRoutes;
        this.diagnostics = diagnostics;
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (!request.decoderResult().isSuccess()) {
            HttpResponses.send(ctx, false, HttpResponses.text(HttpResponseStatus.BAD_REQUEST, "Bad request"));
            return;
        }

        QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
        String path = decoder.path();
        HttpMethod method = request.method();
        log.debug("{} {}", method, request.uri());

        if (request.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
            upgrade(ctx, request, path);
            return;
        }

        try {
            route(ctx, request, method, path, decoder, keepAlive);
        } catch (Exception e) {
            log.error("Request {} {} failed: {}", method, path, e.getMessage(), e);
            HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    Map.of("error", String.valueOf(e.getMessage()))));
        }
    }

    private void route(ChannelHandlerContext ctx, FullHttpRequest request, HttpMethod method, String path,
                       QueryStringDecoder decoder, boolean keepAlive) {
        if (HttpMethod.OPTIONS.equals(method)) {
            HttpResponses.send(ctx, keepAlive, HttpResponses.empty(HttpResponseStatus.OK));
            return;
        }

        if (StreamableHttpTransport.PATH.equals(path)) {
            streamableHttp.handle(ctx, request, keepAlive);
            return;
        }
        if (SseTransport.MESSAGES_PATH.equals(path)) {
            if (!HttpMethod.POST.equals(method)) {
                methodNotAllowed(ctx, keepAlive);
                return;
            }
            sse.post(ctx, request, decoder, keepAlive);
            return;
        }

        if (!HttpMethod.GET.equals(method)) {
            if (isKnownGetPath(path)) {
                methodNotAllowed(ctx, keepAlive);
            } else {
                notFound(ctx, keepAlive, path);
            }
            return;
        }

        if (SseTransport.STREAM_PATH.equals(path) || ("/".equals(path) && acceptsEventStream(request))) {
            sse.open(ctx);
        } else if ("/".equals(path)) {
            HttpResponses.send(ctx, keepAlive,
                    HttpResponses.json(mapper, HttpResponseStatus.OK, diagnostics.sessionList()));
        } else if ("/health".equals(path) || "/status".equals(path)) {
            HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.OK, diagnostics.status()));
        } else if (ResourceHttpRoutes.matches(path)) {
            resourceRoutes.handle(ctx, path, decoder, keepAlive);
        } else {
            notFound(ctx, keepAlive, path);
        }
    }

    private void upgrade(ChannelHandlerContext ctx, FullHttpRequest request, String path) {
        String location = "ws://" + request.headers().get(HttpHeaderNames.HOST) + path;
        WebSocketServerHandshaker handshaker =
                new WebSocketServerHandshakerFactory(location, null, true, maxFrameBytes).newHandshaker(request);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        handshaker.handshake(ctx.channel(), request).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("WebSocket handshake on {} failed: {}", path,
                        f.cause() != null ? f.cause().getMessage() : "unknown");
                ctx.channel().close();
            }
        });

        ChannelPipeline pipeline = ctx.pipeline();
        pipeline.remove(this);
        if (ClientSocketTransport.PATH.equals(path)) {
            clientSockets.attach(pipeline);
        } else {
            tabTransport.attach(pipeline);
        }
    }

    private static boolean acceptsEventStream(FullHttpRequest request) {
        String accept = request.headers().get(HttpHeaderNames.ACCEPT);
        return accept != null && accept.contains(HttpResponses.EVENT_STREAM);
    }

    private static boolean isKnownGetPath(String path) {
        return "/".equals(path) || SseTransport.STREAM_PATH.equals(path) || "/health".equals(path)
                || "/status".equals(path) || ResourceHttpRoutes.matches(path);
    }

    private void methodNotAllowed(ChannelHandlerContext ctx, boolean keepAlive) {
        HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.METHOD_NOT_ALLOWED,
                Map.of("error", "Method not allowed")));
    }

    private void notFound(ChannelHandlerContext ctx, boolean keepAlive, String path) {
        HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.NOT_FOUND,
                Map.of("error", "Not found", "path", path)));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("HTTP channel error: {}", cause.getMessage());
        ctx.close();
    }
}
