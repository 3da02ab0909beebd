package com.tabrelay.common.error;

import lombok.Getter;

@Getter
public class UnknownToolException extends BrokerException {

    public static final String CODE = "UNKNOWN_TOOL";

    private final String toolName;

    public UnknownToolException(String toolName) {
        super(CODE, "Unknown tool: " + toolName);
        this.toolName = toolName;
    }
}
