package com.tabrelay.browser.tabs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrollPosition(double x, double y) {
}
