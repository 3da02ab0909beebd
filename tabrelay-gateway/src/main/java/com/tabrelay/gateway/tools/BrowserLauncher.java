package com.tabrelay.gateway.tools;

import java.io.IOException;

/**
 * Opens a URL in a browser window on the host.
 */
@FunctionalInterface
public interface BrowserLauncher {

    /**
     * @param browser one of {@link NewTabOpener#SUPPORTED_BROWSERS}, or null for the system default
     */
    void open(String url, String browser) throws IOException;
}
