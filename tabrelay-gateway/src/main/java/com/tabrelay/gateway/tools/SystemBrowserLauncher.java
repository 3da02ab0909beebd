package com.tabrelay.gateway.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Launches browsers through the operating system's own open command.
 */
@Slf4j
public class SystemBrowserLauncher implements BrowserLauncher {

    enum Platform { MAC, WINDOWS, LINUX }

    private static final Map<String, String> MAC_APPS = Map.of(
            "chrome", "Google Chrome",
            "edge", "Microsoft Edge",
            "brave", "Brave Browser",
            "opera", "Opera",
            "vivaldi", "Vivaldi");

    private static final Map<String, String> WINDOWS_EXES = Map.of(
            "chrome", "chrome",
            "edge", "msedge",
            "brave", "brave",
            "opera", "opera",
            "vivaldi", "vivaldi");

    private static final Map<String, String> LINUX_EXES = Map.of(
            "chrome", "google-chrome",
            "edge", "microsoft-edge",
            "brave", "brave-browser",
            "opera", "opera",
            "vivaldi", "vivaldi");

    private final Platform platform;

    public SystemBrowserLauncher() {
        this(detect(System.getProperty("os.name", "")));
    }

    SystemBrowserLauncher(Platform platform) {
        this.platform = platform;
    }

    @Override
    public void open(String url, String browser) throws IOException {
        List<String> command = command(url, browser);
        log.info("Launching browser: {}", String.join(" ", command));
        new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
    }

    List<String> command(String url, String browser) {
        String key = browser != null ? browser.toLowerCase(Locale.ROOT) : null;
        List<String> command = new ArrayList<>();
        switch (platform) {
            case MAC -> {
                command.add("open");
                if (key != null) {
                    command.add("-a");
                    command.add(lookup(MAC_APPS, key, browser));
                }
                command.add(url);
            }
            case WINDOWS -> {
                // start treats the first quoted argument as the window title
                command.addAll(List.of("cmd", "/c", "start", "\"\""));
                if (key != null) {
                    command.add(lookup(WINDOWS_EXES, key, browser));
                }
                command.add(url);
            }
            case LINUX -> {
                command.add(key != null ? lookup(LINUX_EXES, key, browser) : "xdg-open");
                command.add(url);
            }
        }
        return command;
    }

    private static String lookup(Map<String, String> table, String key, String browser) {
        String value = table.get(key);
        if (value == null) {
            throw new IllegalArgumentException(NewTabOpener.unsupportedBrowserMessage(browser));
        }
        return value;
    }

    static Platform detect(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return Platform.MAC;
        }
        if (os.contains("win")) {
            return Platform.WINDOWS;
        }
        return Platform.LINUX;
    }
}
