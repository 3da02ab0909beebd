package com.tabrelay.common.error;

import lombok.Getter;

@Getter
public class CommandTimeoutException extends BrokerException {

    public static final String CODE = "TIMEOUT";

    private final String command;
    private final long timeoutMs;

    public CommandTimeoutException(String command, String message, long timeoutMs) {
        super(CODE, message);
        this.command = command;
        this.timeoutMs = timeoutMs;
    }
}
