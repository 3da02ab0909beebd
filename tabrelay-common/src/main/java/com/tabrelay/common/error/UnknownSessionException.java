package com.tabrelay.common.error;

import lombok.Getter;

/**
 * A follow-up request named a session token that matches no live session.
 */
@Getter
public class UnknownSessionException extends BrokerException {

    public static final String CODE = "UNKNOWN_SESSION";

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super(CODE, "Session not found");
        this.sessionId = sessionId;
    }
}
