package com.tabrelay.browser.tabs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page metadata reported by a tab agent, either in full on registration or
 * partially on later updates. A null field means "not reported".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TabMetadata {
    private String browserInstanceId;
    private String browser;
    private String url;
    private String title;
    private Integer domSize;
    private Dimensions fullPageDimensions;
    private Dimensions viewportDimensions;
    private ScrollPosition scrollPosition;
    private PageVisibility pageVisibility;
    private Boolean active;

    /**
     * Returns a copy of this metadata overlaid with every non-null field of {@code partial}.
     */
    public TabMetadata mergedWith(TabMetadata partial) {
        TabMetadataBuilder merged = toBuilder();
        if (partial == null) {
            return merged.build();
        }
        if (partial.browserInstanceId != null) merged.browserInstanceId(partial.browserInstanceId);
        if (partial.browser != null) merged.browser(partial.browser);
        if (partial.url != null) merged.url(partial.url);
        if (partial.title != null) merged.title(partial.title);
        if (partial.domSize != null) merged.domSize(partial.domSize);
        if (partial.fullPageDimensions != null) merged.fullPageDimensions(partial.fullPageDimensions);
        if (partial.viewportDimensions != null) merged.viewportDimensions(partial.viewportDimensions);
        if (partial.scrollPosition != null) merged.scrollPosition(partial.scrollPosition);
        if (partial.pageVisibility != null) merged.pageVisibility(partial.pageVisibility);
        if (partial.active != null) merged.active(partial.active);
        return merged.build();
    }

    public TabMetadata copy() {
        return toBuilder().build();
    }
}
