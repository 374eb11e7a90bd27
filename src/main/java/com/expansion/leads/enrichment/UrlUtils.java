package com.expansion.leads.enrichment;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL helpers. Unparseable input yields empty strings.
 */
public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Lower-cased host without port or a leading "www.".
     */
    public static String host(String url) {
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            return "";
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    /**
     * {@code scheme://authority} with no path, query or fragment.
     */
    public static String baseUrl(String url) {
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            return "";
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "https";
        return scheme + "://" + uri.getRawAuthority();
    }

    public static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    public static boolean sameHost(String a, String b) {
        String hostA = host(a);
        return !hostA.isEmpty() && hostA.equals(host(b));
    }

    private static URI parse(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String u = url.trim();
        if (!u.regionMatches(true, 0, "http", 0, 4)) {
            u = "https://" + u;
        }
        try {
            return new URI(u);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
