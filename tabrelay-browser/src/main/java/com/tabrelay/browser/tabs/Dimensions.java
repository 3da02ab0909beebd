package com.tabrelay.browser.tabs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Dimensions(double width, double height) {
}
