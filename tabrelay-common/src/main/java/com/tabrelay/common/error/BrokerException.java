package com.tabrelay.common.error;

import lombok.Getter;

/**
 * Base of every failure the broker reports to a caller. The code is stable and
 * travels to clients unchanged.
 */
@Getter
public class BrokerException extends RuntimeException {

    private final String code;

    public BrokerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BrokerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
