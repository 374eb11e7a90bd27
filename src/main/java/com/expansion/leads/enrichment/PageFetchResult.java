package com.expansion.leads.enrichment;

import java.util.List;

/**
 * A fetched page reduced to plain text and absolute links.
 *
 * @param url    requested URL
 * @param status HTTP status, or -1 when no response arrived
 * @param text   visible text, empty on failure
 * @param links  anchors with absolute hrefs, empty on failure
 */
public record PageFetchResult(String url, int status, String text, List<PageLink> links) {

    public PageFetchResult {
        url = url != null ? url : "";
        text = text != null ? text : "";
        links = links != null ? List.copyOf(links) : List.of();
    }

    public static PageFetchResult failed(String url, int status) {
        return new PageFetchResult(url, status, "", List.of());
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300 && !text.isBlank();
    }
}
