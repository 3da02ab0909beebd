package com.tabrelay.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 message types spoken by protocol clients.
 * Ids are kept as plain objects since clients send either numbers or strings.
 */
public class JsonRpcMessage {

    public static final String VERSION = "2.0";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Request {
        private String jsonrpc;
        private String method;
        private Object params;
        private Object id;

        public static Request create(String method, Object params, Object id) {
            return Request.builder()
                    .jsonrpc(VERSION)
                    .method(method)
                    .params(params)
                    .id(id)
                    .build();
        }

        /** A request without an id expects no response. */
        @JsonIgnore
        public boolean isNotification() {
            return id == null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        private String jsonrpc;
        private Object result;
        private RpcError error;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private Object id;

        public static Response success(Object id, Object result) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .result(result)
                    .id(id)
                    .build();
        }

        public static Response error(Object id, int code, String message) {
            return error(id, code, message, null);
        }

        public static Response error(Object id, int code, String message, Object data) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .error(new RpcError(code, message, data))
                    .id(id)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Notification {
        private String jsonrpc;
        private String method;
        private Object params;

        public static Notification create(String method, Object params) {
            return Notification.builder()
                    .jsonrpc(VERSION)
                    .method(method)
                    .params(params)
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RpcError {
        private int code;
        private String message;
        private Object data;
    }

    // Standard error codes
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    // Broker-specific codes
    public static final int MISSING_SESSION = -32000;
    public static final int SESSION_NOT_FOUND = -32001;
    public static final int SERVER_NOT_INITIALIZED = -32002;
}
