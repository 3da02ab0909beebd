package com.tabrelay.common.error;

/**
 * Fatal failure while bringing the broker up, e.g. the port is already taken.
 */
public class BrokerStartupException extends BrokerException {

    public static final String CODE = "STARTUP_FAILED";

    public BrokerStartupException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
