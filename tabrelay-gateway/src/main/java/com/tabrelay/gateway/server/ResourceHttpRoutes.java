package com.tabrelay.gateway.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.common.error.BrokerException;
import com.tabrelay.common.error.CommandTimeoutException;
import com.tabrelay.common.error.TabNotConnectedException;
import com.tabrelay.gateway.resources.ResourceHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain HTTP mirrors of the tab resources, handy for curl and for opening a
 * screenshot straight in a browser.
 */
@Slf4j
public class ResourceHttpRoutes {

    private static final Pattern TAB_PATH = Pattern.compile("^/tab/([^/]+)(/console|/screenshot|/screenshot/view)?/?$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d{1,15}(\\.\\d+)?$");

    private final ObjectMapper mapper;
    private final ResourceHandler resources;

    public ResourceHttpRoutes(ObjectMapper mapper, ResourceHandler resources) {
        this.mapper = mapper;
        this.resources = resources;
    }

    public static boolean matches(String path) {
        return "/tabs".equals(path) || TAB_PATH.matcher(path).matches();
    }

    public void handle(ChannelHandlerContext ctx, String path, QueryStringDecoder decoder, boolean keepAlive) {
        if ("/tabs".equals(path)) {
            HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.OK, resources.tabs()));
            return;
        }
        Matcher m = TAB_PATH.matcher(path);
        if (!m.matches()) {
            HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.NOT_FOUND,
                    Map.of("error", "Not found", "path", path)));
            return;
        }
        String tabId = m.group(1);
        String part = m.group(2);

        if (part == null) {
            try {
                HttpResponses.send(ctx, keepAlive,
                        HttpResponses.json(mapper, HttpResponseStatus.OK, resources.tab(tabId)));
            } catch (TabNotConnectedException e) {
                sendError(ctx, keepAlive, e);
            }
            return;
        }

        ObjectNode params = queryParams(decoder);
        switch (part) {
            case "/console" -> respondJson(ctx, keepAlive, resources.console(tabId, params));
            case "/screenshot" -> respondJson(ctx, keepAlive, resources.screenshot(tabId, params));
            default -> resources.screenshot(tabId, params).whenComplete((shot, error) -> {
                if (error != null) {
                    sendError(ctx, keepAlive, error);
                    return;
                }
                String mimeType = shot.path("mimeType").asText("image/" + params.path("format").asText("webp"));
                try {
                    byte[] image = decodeImage(shot.path("data").asText(""));
                    HttpResponses.send(ctx, keepAlive, HttpResponses.bytes(HttpResponseStatus.OK, mimeType, image));
                } catch (IllegalArgumentException e) {
                    log.warn("Screenshot of tab {} carried undecodable data: {}", tabId, e.getMessage());
                    sendError(ctx, keepAlive, new BrokerException("NO_IMAGE", "Screenshot data is not valid base64"));
                }
            });
        }
    }

    private void respondJson(ChannelHandlerContext ctx, boolean keepAlive, CompletableFuture<JsonNode> result) {
        result.whenComplete((value, error) -> {
            if (error != null) {
                sendError(ctx, keepAlive, error);
            } else {
                HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, HttpResponseStatus.OK, value));
            }
        });
    }

    private void sendError(ChannelHandlerContext ctx, boolean keepAlive, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        HttpResponseStatus status;
        String code;
        if (cause instanceof TabNotConnectedException e) {
            status = HttpResponseStatus.NOT_FOUND;
            code = e.getCode();
        } else if (cause instanceof CommandTimeoutException e) {
            status = HttpResponseStatus.GATEWAY_TIMEOUT;
            code = e.getCode();
        } else if (cause instanceof BrokerException e) {
            status = HttpResponseStatus.BAD_GATEWAY;
            code = e.getCode();
        } else {
            log.error("Resource route failed: {}", cause.getMessage(), cause);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            code = "INTERNAL_ERROR";
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", cause.getMessage());
        body.put("code", code);
        HttpResponses.send(ctx, keepAlive, HttpResponses.json(mapper, status, body));
    }

    /**
     * Query string as command params. Numeric and boolean values keep their type
     * so {@code ?scale=0.5} reaches the agent as a number.
     */
    ObjectNode queryParams(QueryStringDecoder decoder) {
        ObjectNode params = mapper.createObjectNode();
        for (Map.Entry<String, List<String>> entry : decoder.parameters().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String value = entry.getValue().get(0);
            if (NUMBER.matcher(value).matches()) {
                if (value.contains(".")) {
                    params.put(entry.getKey(), Double.parseDouble(value));
                } else {
                    params.put(entry.getKey(), Long.parseLong(value));
                }
            } else if ("true".equals(value) || "false".equals(value)) {
                params.put(entry.getKey(), Boolean.parseBoolean(value));
            } else {
                params.put(entry.getKey(), value);
            }
        }
        return params;
    }

    static byte[] decodeImage(String data) {
        int comma = data.startsWith("data:") ? data.indexOf(',') : -1;
        return Base64.getDecoder().decode(comma >= 0 ? data.substring(comma + 1) : data);
    }
}
