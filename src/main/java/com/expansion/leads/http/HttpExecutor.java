package com.expansion.leads.http;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.enrichment.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * The one retrying HTTP boundary shared by all upstream clients.
 *
 * <p>Retries 429, 5xx and I/O failures with exponential backoff up to the configured attempt count.
 * A 404 is returned to the caller as a not-found result. Any other 4xx fails at once.
 * When retries run out an {@link UpstreamException} carries the last status.</p>
 */
public class HttpExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpExecutor.class);

    private final HttpClient httpClient;
    private final HttpConfig config;
    private final Sleeper sleeper;

    public HttpExecutor(HttpConfig config) {
        this(HttpClient.newBuilder()
                        .connectTimeout(config.connectTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                config, Sleeper.threadSleep());
    }

    public HttpExecutor(HttpClient httpClient, HttpConfig config, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.config = config;
        this.sleeper = sleeper;
    }

    public HttpResult execute(HttpRequest request) {
        return execute(request, config.maxAttempts());
    }

    /**
     * @param maxAttempts attempts including the first; 1 disables retries
     */
    public HttpResult execute(HttpRequest request, int maxAttempts) {
        int lastStatus = -1;
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration backoff = config.initialBackoff().multipliedBy(1L << (attempt - 2));
                log.debug("http.retry uri={} attempt={} backoffMs={}", redact(request), attempt, backoff.toMillis());
                sleeper.sleep(backoff);
            }
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status == 429 || status >= 500) {
                    lastStatus = status;
                    lastFailure = null;
                    log.warn("http.transient uri={} status={} attempt={}", redact(request), status, attempt);
                    continue;
                }
                if (status >= 400 && status != 404) {
                    throw new UpstreamException("HTTP " + status + " from " + redact(request), status);
                }
                return new HttpResult(status, response.body(),
                        response.headers().firstValue("Content-Type").orElse(""),
                        response.uri().toString());
            } catch (IOException e) {
                lastFailure = e;
                lastStatus = -1;
                log.warn("http.io uri={} attempt={} error={}", redact(request), attempt, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamException("Interrupted calling " + redact(request), e);
            }
        }

        if (lastFailure != null) {
            throw new UpstreamException("Giving up on " + redact(request) + " after " + maxAttempts + " attempts",
                    lastFailure);
        }
        throw new UpstreamException("Giving up on " + redact(request) + " after " + maxAttempts
                + " attempts, last status " + lastStatus, lastStatus);
    }

    // Query strings may carry API keys.
    private static String redact(HttpRequest request) {
        String uri = request.uri().toString();
        int q = uri.indexOf('?');
        return q >= 0 ? uri.substring(0, q) : uri;
    }
}
