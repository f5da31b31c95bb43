package com.shipcheck.infra;

import io.micronaut.http.client.DefaultHttpClientConfiguration;
import io.micronaut.http.client.HttpClient;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.Locale;

/**
 * Builds short-lived Micronaut clients for caller-supplied absolute URLs
 * (published pages, callback endpoints, collaborator services).
 */
public final class OutboundHttp {

    private OutboundHttp() {
    }

    /**
     * Client rooted at the URL's scheme, host and port with the given read timeout.
     * Pair with {@link #pathOf(URI)} for the request target.
     */
    public static HttpClient create(URI target, Duration readTimeout) throws MalformedURLException {
        if (target.getScheme() == null || target.getHost() == null) {
            throw new MalformedURLException("Not an absolute URL: " + target);
        }
        String scheme = target.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new MalformedURLException("Unsupported scheme: " + target.getScheme());
        }
        DefaultHttpClientConfiguration config = new DefaultHttpClientConfiguration();
        config.setReadTimeout(readTimeout);
        config.setFollowRedirects(true);
        URL base = new URL(scheme, target.getHost(), target.getPort(), "");
        return HttpClient.create(base, config);
    }

    /** Path plus query of an absolute URI, "/" when the path is empty. */
    public static String pathOf(URI target) {
        String path = target.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        return target.getRawQuery() != null ? path + "?" + target.getRawQuery() : path;
    }

    /**
     * Parse a caller-supplied URL. Returns null for anything that is not an
     * absolute http(s) URL.
     */
    public static URI parse(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) return null;
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return null;
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
