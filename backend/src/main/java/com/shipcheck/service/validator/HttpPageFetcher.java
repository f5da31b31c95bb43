package com.shipcheck.service.validator;

import com.shipcheck.infra.OutboundHttp;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.client.exceptions.ReadTimeoutException;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Production {@link PageFetcher} on the Micronaut HTTP client. Redirects are
 * followed; non-2xx responses are returned, not thrown.
 */
@Singleton
public class HttpPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    static final String USER_AGENT = "Mozilla/5.0 (ShipCheck Validation Bot)";

    @Override
    public FetchResult fetch(String url, Duration timeout) {
        long start = System.currentTimeMillis();
        URI target = OutboundHttp.parse(url);
        if (target == null) {
            return FetchResult.networkError("Invalid page URL: " + url, 0);
        }

        try (HttpClient client = OutboundHttp.create(target, timeout)) {
            HttpResponse<String> response = client.toBlocking().exchange(
                HttpRequest.GET(OutboundHttp.pathOf(target)).header(HttpHeaders.USER_AGENT, USER_AGENT),
                String.class);
            long elapsed = System.currentTimeMillis() - start;
            log.debug("GET {} -> {} in {}ms", url, response.getStatus().getCode(), elapsed);
            return new FetchResult(response.getStatus().getCode(), response.getBody().orElse(""), elapsed, null);

        } catch (HttpClientResponseException e) {
            long elapsed = System.currentTimeMillis() - start;
            String body = e.getResponse().getBody(String.class).orElse("");
            return new FetchResult(e.getStatus().getCode(), body, elapsed, null);

        } catch (ReadTimeoutException e) {
            long elapsed = System.currentTimeMillis() - start;
            return FetchResult.networkError("Page request timed out after " + timeout.toSeconds() + "s", elapsed);

        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Page fetch failed for {}: {}", url, e.getMessage());
            return FetchResult.networkError("Failed to fetch page: " + e.getMessage(), elapsed);
        }
    }
}
