package com.tabrelay.gateway.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of tools/call: typed content parts plus an error flag.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    private List<ContentPart> content = new ArrayList<>();

    @JsonProperty("isError")
    private Boolean error;

    public static ToolResult text(String text) {
        ToolResult result = new ToolResult();
        result.content.add(ContentPart.text(text));
        return result;
    }

    public static ToolResult failure(String text) {
        ToolResult result = text(text);
        result.error = Boolean.TRUE;
        return result;
    }

    public ToolResult withImage(String mimeType, String data) {
        content.add(ContentPart.builder().type("image").mimeType(mimeType).data(data).build());
        return this;
    }

    @JsonIgnore
    public boolean isFailure() {
        return Boolean.TRUE.equals(error);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContentPart {
        private String type;
        private String text;
        private String mimeType;
        private String data;

        public static ContentPart text(String text) {
            return ContentPart.builder().type("text").text(text).build();
        }
    }
}
