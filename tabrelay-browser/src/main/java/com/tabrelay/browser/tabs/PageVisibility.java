package com.tabrelay.browser.tabs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PageVisibility(boolean visible, String visibilityState) {
}
