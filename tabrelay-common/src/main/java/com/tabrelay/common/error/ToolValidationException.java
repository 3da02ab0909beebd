package com.tabrelay.common.error;

import lombok.Getter;

import java.util.List;

/**
 * Tool arguments failed validation. Carries one entry per failed check.
 */
@Getter
public class ToolValidationException extends BrokerException {

    public static final String CODE = "INVALID_ARGUMENTS";

    private final String toolName;
    private final List<String> errors;

    public ToolValidationException(String toolName, List<String> errors) {
        super(CODE, "Invalid arguments for " + toolName + ": " + String.join("; ", errors));
        this.toolName = toolName;
        this.errors = List.copyOf(errors);
    }
}
