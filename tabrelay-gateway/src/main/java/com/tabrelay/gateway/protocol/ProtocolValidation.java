package com.tabrelay.gateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.model.JsonRpcMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope checks for incoming JSON-RPC messages and formatting of validation errors.
 */
public final class ProtocolValidation {

    private ProtocolValidation() {
    }

    /**
     * Structural problems with a JSON-RPC request or notification; empty when valid.
     */
    public static List<String> validateRequest(JsonNode message) {
        List<String> errors = new ArrayList<>();
        if (message == null || !message.isObject()) {
            errors.add("message must be a JSON object");
            return errors;
        }
        if (!JsonRpcMessage.VERSION.equals(message.path("jsonrpc").asText(null))) {
            errors.add("jsonrpc must be \"2.0\"");
        }
        JsonNode method = message.get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            errors.add("method must be a non-empty string");
        }
        JsonNode id = message.get("id");
        if (id != null && !id.isNull() && !id.isTextual() && !id.isNumber()) {
            errors.add("id must be a string or number");
        }
        JsonNode params = message.get("params");
        if (params != null && !params.isNull() && !params.isObject() && !params.isArray()) {
            errors.add("params must be an object or array");
        }
        return errors;
    }

    /**
     * Joins problems with {@code "; "}, dropping blanks and repeats.
     */
    public static String formatValidationErrors(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "no details";
        }
        List<String> unique = errors.stream()
                .filter(e -> e != null && !e.isBlank())
                .distinct()
                .toList();
        if (unique.isEmpty()) {
            return "no details";
        }
        return String.join("; ", unique);
    }
}
