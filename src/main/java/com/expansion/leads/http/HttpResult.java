package com.expansion.leads.http;

/**
 * A completed HTTP exchange.
 *
 * @param status      response status
 * @param body        response body, empty when there was none
 * @param contentType Content-Type header, or empty
 * @param finalUrl    URL after redirects
 */
public record HttpResult(int status, String body, String contentType, String finalUrl) {

    public HttpResult {
        body = body != null ? body : "";
        contentType = contentType != null ? contentType : "";
        finalUrl = finalUrl != null ? finalUrl : "";
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
