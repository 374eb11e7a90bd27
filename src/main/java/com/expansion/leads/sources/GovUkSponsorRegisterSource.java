package com.expansion.leads.sources;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.http.HttpExecutor;
import com.expansion.leads.http.HttpResult;
import com.expansion.leads.core.model.SourceRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Downloads the sponsor register.
 *
 * <p>The location may point at the CSV directly, at the GOV.UK publication page (the latest CSV
 * link is picked from it, preferring the assets host) or at a local file.</p>
 */
public class GovUkSponsorRegisterSource implements SponsorRegisterSource {
    private static final Logger log = LoggerFactory.getLogger(GovUkSponsorRegisterSource.class);

    public static final String PUBLICATION_PAGE =
            "https://www.gov.uk/government/publications/register-of-licensed-sponsors-workers";
    private static final String ASSETS_HOST = "assets.publishing.service.gov.uk";
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(60);

    private final String location;
    private final HttpExecutor executor;
    private final HttpConfig httpConfig;
    private final SponsorRegisterParser parser;

    public GovUkSponsorRegisterSource(String location, HttpExecutor executor, HttpConfig httpConfig,
                                      SponsorRegisterParser parser) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Sponsor register location is not configured");
        }
        this.location = location.trim();
        this.executor = executor;
        this.httpConfig = httpConfig;
        this.parser = parser;
    }

    @Override
    public List<SourceRecord> fetch() {
        if (!isHttp(location)) {
            return parseFile(Path.of(location.startsWith("file:") ? URI.create(location).getPath() : location));
        }
        String csvUrl = isCsv(location) ? location : findCsvLink(download(location).body(), location);
        log.info("sponsor.download url={}", csvUrl);
        HttpResult csv = download(csvUrl);
        try (Reader reader = new StringReader(csv.body())) {
            return parser.parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Picks the register CSV link from the publication page.
     */
    static String findCsvLink(String html, String pageUrl) {
        Document doc = Jsoup.parse(html, pageUrl);
        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = anchor.attr("href");
            }
            if (href.toLowerCase(Locale.ROOT).contains(".csv")) {
                links.add(href);
            }
        }
        if (links.isEmpty()) {
            throw new UpstreamException("No CSV link on sponsor register page " + pageUrl, 200);
        }
        return links.stream()
                .filter(link -> link.contains(ASSETS_HOST))
                .findFirst()
                .orElse(links.get(0));
    }

    private HttpResult download(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(DOWNLOAD_TIMEOUT)
                .header("User-Agent", httpConfig.userAgent())
                .GET()
                .build();
        HttpResult result = executor.execute(request);
        if (!result.isSuccess()) {
            throw new UpstreamException("Sponsor register download failed for " + url, result.status());
        }
        return result;
    }

    private List<SourceRecord> parseFile(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parser.parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read sponsor register file " + path, e);
        }
    }

    private static boolean isHttp(String location) {
        String l = location.toLowerCase(Locale.ROOT);
        return l.startsWith("http://") || l.startsWith("https://");
    }

    private static boolean isCsv(String location) {
        String path = URI.create(location).getPath();
        return path != null && path.toLowerCase(Locale.ROOT).endsWith(".csv");
    }
}
