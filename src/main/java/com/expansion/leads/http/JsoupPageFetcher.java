package com.expansion.leads.http;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.enrichment.PageFetchResult;
import com.expansion.leads.enrichment.PageFetcher;
import com.expansion.leads.enrichment.PageLink;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fetches a page with a single attempt and reduces the HTML to visible text and absolute links.
 */
public class JsoupPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final HttpExecutor executor;
    private final HttpConfig config;

    public JsoupPageFetcher(HttpExecutor executor, HttpConfig config) {
        this.executor = executor;
        this.config = config;
    }

    @Override
    public PageFetchResult fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(config.pageTimeout())
                    .header("User-Agent", config.userAgent())
                    .header("Accept", "text/html,application/xhtml+xml")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            log.debug("page.invalid url={} error={}", url, e.getMessage());
            return PageFetchResult.failed(url, -1);
        }

        HttpResult result;
        try {
            result = executor.execute(request, 1);
        } catch (UpstreamException e) {
            log.debug("page.failed url={} status={}", url, e.getStatus());
            return PageFetchResult.failed(url, e.getStatus());
        }
        if (!result.isSuccess()) {
            return PageFetchResult.failed(url, result.status());
        }
        String contentType = result.contentType().toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty() && !contentType.contains("html")) {
            return PageFetchResult.failed(url, result.status());
        }
        return parse(url, result);
    }

    static PageFetchResult parse(String url, HttpResult result) {
        String baseUri = result.finalUrl().isEmpty() ? url : result.finalUrl();
        Document doc = Jsoup.parse(result.body(), baseUri);
        List<PageLink> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (!href.isEmpty()) {
                links.add(new PageLink(href, anchor.text()));
            }
        }
        String text = doc.body() != null ? doc.body().text() : doc.text();
        return new PageFetchResult(url, result.status(), text, links);
    }
}
