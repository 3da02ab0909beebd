package com.tabrelay.browser.tabs;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-ready views of tab sessions shared by tools, resources and notifications.
 */
public final class TabViews {

    private TabViews() {
    }

    public static Map<String, Object> detail(TabSession tab) {
        TabMetadata m = tab.metadata();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("tabId", tab.tabId());
        view.put("url", m.getUrl());
        view.put("title", m.getTitle());
        view.put("browser", m.getBrowser());
        view.put("active", tab.isActive());
        view.put("connectedAt", tab.connectedAt().toString());
        view.put("lastPing", tab.lastPing().toString());
        view.put("domSize", m.getDomSize());
        view.put("fullPageDimensions", m.getFullPageDimensions());
        view.put("viewportDimensions", m.getViewportDimensions());
        view.put("scrollPosition", m.getScrollPosition());
        view.put("pageVisibility", m.getPageVisibility());
        return view;
    }

    /**
     * Short form used in tab lists and change notifications.
     */
    public static Map<String, Object> summary(TabSession tab) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("tabId", tab.tabId());
        view.put("url", tab.url());
        view.put("title", tab.title());
        view.put("browser", tab.metadata().getBrowser());
        view.put("active", tab.isActive());
        return view;
    }
}
