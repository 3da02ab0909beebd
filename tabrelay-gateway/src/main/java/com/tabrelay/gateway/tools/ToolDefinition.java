package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tool as declared in the catalog and listed to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolDefinition {
    private String name;
    private String description;
    private ObjectNode inputSchema;

    /** Remote command name when it differs from the tool name. Never shown to clients. */
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String command;

    @JsonIgnore
    public String remoteCommand() {
        return command != null && !command.isBlank() ? command : name;
    }
}
