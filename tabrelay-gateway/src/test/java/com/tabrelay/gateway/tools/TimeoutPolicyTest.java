package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutPolicyTest {

    private static final long DEFAULT = 5000;

    private final ObjectMapper mapper = new ObjectMapper();

    private ObjectNode args() {
        return mapper.createObjectNode().put("tabId", "t1");
    }

    @Test
    void plainTool_usesDefaultOrCallerTimeout() {
        assertEquals(DEFAULT, TimeoutPolicy.commandTimeout("dom", args(), DEFAULT));
        assertEquals(1234, TimeoutPolicy.commandTimeout("dom", args().put("timeout", 1234), DEFAULT));
    }

    @Test
    void click_defaultsToEightSeconds() {
        assertEquals(8000, TimeoutPolicy.commandTimeout("click", args(), DEFAULT));
        assertEquals(300, TimeoutPolicy.commandTimeout("click", args().put("timeout", 300), DEFAULT));
    }

    @Test
    void waitForElement_addsOverheadToCallerTimeout() {
        assertEquals(12000, TimeoutPolicy.commandTimeout("wait_for_element", args().put("timeout", 10000), DEFAULT));
        assertEquals(DEFAULT, TimeoutPolicy.commandTimeout("wait_for_element", args(), DEFAULT));
    }

    @Test
    void type_scalesWithTextLengthAndDelay() {
        String text = "x".repeat(200);
        // 200 * 50 + 5000
        assertEquals(15000, TimeoutPolicy.commandTimeout("type", args().put("text", text), DEFAULT));
        // 200 * 100 + 5000
        assertEquals(25000, TimeoutPolicy.commandTimeout("type", args().put("text", text).put("delay", 100), DEFAULT));
        assertEquals(5000, TimeoutPolicy.commandTimeout("type", args().put("text", "hi").put("delay", 0), DEFAULT));
        assertEquals(700, TimeoutPolicy.commandTimeout("type", args().put("text", text).put("timeout", 700), DEFAULT));
    }

    @Test
    void keypress_delayWithoutTimeout_coversDelay() {
        assertEquals(5000, TimeoutPolicy.commandTimeout("keypress", args().put("delay", 100), DEFAULT));
        assertEquals(9000, TimeoutPolicy.commandTimeout("keypress", args().put("delay", 7000), DEFAULT));
        assertEquals(2500, TimeoutPolicy.commandTimeout("keypress",
                args().put("delay", 7000).put("timeout", 2500), DEFAULT));
        assertEquals(DEFAULT, TimeoutPolicy.commandTimeout("keypress", args(), DEFAULT));
    }
}
