package com.tabrelay.gateway.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Name and version a client reports in its initialize request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientInfo(String name, String version) {
}
