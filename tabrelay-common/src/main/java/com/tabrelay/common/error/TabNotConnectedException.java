package com.tabrelay.common.error;

import lombok.Getter;

/**
 * No live agent connection exists for the requested tab.
 */
@Getter
public class TabNotConnectedException extends BrokerException {

    public static final String CODE = "TAB_NOT_CONNECTED";

    private final String tabId;

    public TabNotConnectedException(String tabId) {
        super(CODE, "Tab not connected: " + tabId);
        this.tabId = tabId;
    }
}
