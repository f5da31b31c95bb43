package com.shipcheck;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckSpec;
import com.shipcheck.dto.LiveResult;
import com.shipcheck.service.validator.FetchResult;
import com.shipcheck.service.validator.LiveValidator;
import com.shipcheck.service.validator.PageFetcher;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@MicronautTest
class LiveValidatorTest {

    private static final String URL = "https://student.github.io/demo/";

    @Inject LiveValidator validator;
    @Inject PageFetcher pageFetcher;   // resolves to the mock below

    @MockBean(PageFetcher.class)
    PageFetcher mockFetcher() {
        return mock(PageFetcher.class);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static final String LIVE_HTML = "<!DOCTYPE html><html><head><title>Calculator</title>"
        + "<link rel='stylesheet' href='https://cdn.jsdelivr.net/npm/bootstrap@5.3.0/dist/css/bootstrap.min.css'>"
        + "</head><body><div id='result'>0</div>"
        + "<script src='https://cdn.jsdelivr.net/npm/bootstrap@5.3.0/dist/js/bootstrap.bundle.min.js'></script>"
        + "</body></html>";

    private List<CheckSpec> checks(String... texts) {
        return Arrays.stream(texts).map(CheckSpec::new).toList();
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void validate_status500_failsWithoutRunningChecks() {
        when(pageFetcher.fetch(any(), any())).thenReturn(new FetchResult(500, "<h1>oops</h1>", 40, null));

        LiveResult result = validator.validate(URL, checks("Page has element with id='result'"));

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).containsExactly("Page returned HTTP 500");
        assertThat(result.checks()).isEmpty();
        assertThat(result.pageInfo().statusCode()).isEqualTo(500);
    }

    @Test
    void validate_networkFailure_statusMinusOne() {
        when(pageFetcher.fetch(any(), any()))
            .thenReturn(FetchResult.networkError("Page request timed out after 10s", 10_000));

        LiveResult result = validator.validate(URL, checks("Page has element with id='result'"));

        assertThat(result.passed()).isFalse();
        assertThat(result.pageInfo().statusCode()).isEqualTo(-1);
        assertThat(result.errors()).containsExactly("Page request timed out after 10s");
    }

    @Test
    void validate_emptyBody_fails() {
        when(pageFetcher.fetch(any(), any())).thenReturn(new FetchResult(200, "  ", 12, null));

        LiveResult result = validator.validate(URL, List.of());

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).containsExactly("Page returned an empty body");
    }

    @Test
    void validate_healthyPage_runsObservableChecksOnly() {
        when(pageFetcher.fetch(any(), any())).thenReturn(new FetchResult(200, LIVE_HTML, 85, null));

        LiveResult result = validator.validate(URL, checks(
            "Repo has MIT license",
            "Page has element with id='result'",
            "Page loads Bootstrap 5 from CDN"));

        assertThat(result.passed()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.checks()).extracting(r -> r.category()).containsExactly(
            CheckCategory.HTML_ELEMENT_BY_ID, CheckCategory.CDN_SCRIPT_PRESENCE);
        assertThat(result.pageInfo().title()).isEqualTo("Calculator");
        assertThat(result.pageInfo().scriptCount()).isEqualTo(1);
        assertThat(result.pageInfo().linkCount()).isEqualTo(1);
        assertThat(result.pageInfo().responseTimeMs()).isEqualTo(85);
    }

    @Test
    void validate_elementMissingOnLivePage_becomesError() {
        when(pageFetcher.fetch(any(), any())).thenReturn(new FetchResult(200, LIVE_HTML, 20, null));

        LiveResult result = validator.validate(URL, checks("Page has element with id='total'"));

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).singleElement().asString()
            .startsWith("Live check failed: Page has element with id='total'");
    }

    @Test
    void validate_errorBannerAndTinyBody_warningsOnly() {
        when(pageFetcher.fetch(any(), any()))
            .thenReturn(new FetchResult(200, "<p>Uncaught TypeError: x</p>", 20, null));

        LiveResult result = validator.validate(URL, List.of());

        assertThat(result.passed()).isTrue();
        assertThat(result.warnings()).anyMatch(w -> w.contains("uncaught typeerror"));
        assertThat(result.warnings()).anyMatch(w -> w.startsWith("Page HTML is very short"));
    }

    @Test
    void validate_usesConfiguredTimeout() {
        when(pageFetcher.fetch(any(), any())).thenReturn(new FetchResult(200, LIVE_HTML, 5, null));

        validator.validate(URL, List.of());

        verify(pageFetcher, atLeastOnce()).fetch(eq(URL), eq(Duration.ofSeconds(2)));
    }
}
