package com.shipcheck;

import com.shipcheck.service.validator.FetchResult;
import com.shipcheck.service.validator.HttpPageFetcher;
import io.micronaut.runtime.server.EmbeddedServer;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class HttpPageFetcherTest {

    @Inject HttpPageFetcher fetcher;
    @Inject EmbeddedServer server;

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void fetch_ok_returnsStatusAndBody() {
        FetchResult result = fetcher.fetch(server.getURL() + "/health", TIMEOUT);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.success()).isTrue();
        assertThat(result.body()).contains("healthy");
        assertThat(result.elapsedMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void fetch_notFound_returnsStatusInsteadOfThrowing() {
        FetchResult result = fetcher.fetch(server.getURL() + "/no-such-page", TIMEOUT);

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.reachedServer()).isTrue();
        assertThat(result.success()).isFalse();
    }

    @Test
    void fetch_invalidUrl_networkError() {
        FetchResult result = fetcher.fetch("ftp://example.com/page", TIMEOUT);

        assertThat(result.statusCode()).isEqualTo(-1);
        assertThat(result.error()).startsWith("Invalid page URL");
    }

    @Test
    void fetch_connectionRefused_networkError() {
        FetchResult result = fetcher.fetch("http://127.0.0.1:1/", TIMEOUT);

        assertThat(result.statusCode()).isEqualTo(-1);
        assertThat(result.error()).isNotBlank();
    }
}
