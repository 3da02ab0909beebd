package com.tabrelay.gateway.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabrelay.common.model.JsonRpcMessage;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Response builders shared by every HTTP route. All responses carry CORS headers.
 */
@Slf4j
public final class HttpResponses {

    private HttpResponses() {
    }

    public static final String SESSION_HEADER = "Mcp-Session-Id";
    public static final String SESSION_TIMEOUT_HEADER = "Mcp-Session-Timeout";
    public static final String EVENT_STREAM = "text/event-stream";
    public static final String APPLICATION_JSON = "application/json";

    private static final String ALLOWED_METHODS = "GET, POST, DELETE, OPTIONS";
    private static final String ALLOWED_HEADERS =
            "Content-Type, Accept, Authorization, Mcp-Session-Id, Mcp-Session-Timeout, Mcp-Protocol-Version";

    public static FullHttpResponse json(ObjectMapper mapper, HttpResponseStatus status, Object body) {
        try {
            return bytes(status, APPLICATION_JSON, mapper.writeValueAsBytes(body));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response: {}", e.getMessage(), e);
            return text(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Failed to encode response");
        }
    }

    public static FullHttpResponse jsonText(HttpResponseStatus status, String json) {
        return bytes(status, APPLICATION_JSON, json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A JSON-RPC error envelope with a null id, for failures detected before a
     * message reaches the protocol handler.
     */
    public static FullHttpResponse rpcError(ObjectMapper mapper, HttpResponseStatus status, int code, String message) {
        return json(mapper, status, JsonRpcMessage.Response.error(null, code, message));
    }

    public static FullHttpResponse text(HttpResponseStatus status, String body) {
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        return response;
    }

    public static FullHttpResponse bytes(HttpResponseStatus status, String contentType, byte[] body) {
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        return response;
    }

    public static FullHttpResponse empty(HttpResponseStatus status) {
        return new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
    }

    public static void applyCors(HttpHeaders headers) {
        headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
        headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS);
        headers.set(HttpHeaderNames.ACCESS_CONTROL_EXPOSE_HEADERS, SESSION_HEADER);
    }

    /**
     * Write a complete response, closing the connection afterwards unless the
     * client asked to keep it alive.
     */
    public static void send(ChannelHandlerContext ctx, boolean keepAlive, FullHttpResponse response) {
        applyCors(response.headers());
        HttpUtil.setContentLength(response, response.content().readableBytes());
        if (keepAlive) {
            HttpUtil.setKeepAlive(response, true);
            ctx.writeAndFlush(response);
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
