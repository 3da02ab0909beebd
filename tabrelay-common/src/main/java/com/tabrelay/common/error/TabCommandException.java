package com.tabrelay.common.error;

/**
 * The tab agent ran the command and reported a failure. The agent's message and
 * code are kept verbatim.
 */
public class TabCommandException extends BrokerException {

    public static final String DEFAULT_CODE = "COMMAND_FAILED";

    public TabCommandException(String code, String message) {
        super(code != null && !code.isBlank() ? code : DEFAULT_CODE,
                message != null ? message : "Command failed");
    }
}
