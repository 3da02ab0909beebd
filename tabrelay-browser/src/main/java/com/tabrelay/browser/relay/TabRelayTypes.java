package com.tabrelay.browser.relay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire types exchanged with tab agents over their WebSocket.
 *
 * <p>Protocol overview:
 * <ul>
 *   <li>Agent → Broker: {@code register}, {@code tabInfo}, {@link ResponseMessage},
 *       {@code console}/{@code console_log}, {@code ping}</li>
 *   <li>Broker → Agent: {@link CommandMessage}, {@code pong}</li>
 * </ul>
 */
public final class TabRelayTypes {

    private TabRelayTypes() {
    }

    public static final String TYPE_REGISTER = "register";
    public static final String TYPE_TAB_INFO = "tabInfo";
    public static final String TYPE_COMMAND = "command";
    public static final String TYPE_RESPONSE = "response";
    public static final String TYPE_CONSOLE = "console";
    public static final String TYPE_CONSOLE_LOG = "console_log";
    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";

    // ==================== Broker → Agent ====================

    /** Command addressed to one tab agent. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CommandMessage {
        private String id;
        private String type;
        private String command;
        private JsonNode params;

        public static CommandMessage create(String id, String command, JsonNode params) {
            return CommandMessage.builder()
                    .id(id)
                    .type(TYPE_COMMAND)
                    .command(command)
                    .params(params)
                    .build();
        }
    }

    /** Heartbeat reply to an agent {@code ping}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PongMessage {
        private String type = TYPE_PONG;
    }

    // ==================== Agent → Broker ====================

    /** Reply to a {@link CommandMessage}, matched by id. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseMessage {
        private String id;
        private String type;
        private boolean success;
        private JsonNode result;
        private ErrorInfo error;

        public static ResponseMessage ok(String id, JsonNode result) {
            return ResponseMessage.builder().id(id).type(TYPE_RESPONSE).success(true).result(result).build();
        }

        public static ResponseMessage failed(String id, String code, String message) {
            return ResponseMessage.builder().id(id).type(TYPE_RESPONSE).success(false)
                    .error(new ErrorInfo(message, code)).build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorInfo {
        private String message;
        private String code;
    }
}
