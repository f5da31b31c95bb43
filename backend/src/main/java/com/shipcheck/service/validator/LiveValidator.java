package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import com.shipcheck.domain.PageInfo;
import com.shipcheck.dto.LiveResult;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates the published page:
 *   1. fetch with a bounded timeout, always recording a {@link PageInfo}
 *   2. stop with a failure on a non-2xx status or an empty body
 *   3. re-run the element-id and CDN checks against the live HTML
 *   4. scan rendered text for obvious error banners (warnings only)
 */
@Singleton
public class LiveValidator {

    private static final Logger log = LoggerFactory.getLogger(LiveValidator.class);

    static final int MIN_HTML_BYTES = 100;

    /** Lower-case markers of broken pages; a hit is a heuristic warning. */
    static final List<String> ERROR_MARKERS = List.of(
        "traceback (most recent call last)",
        "undefined is not a function",
        "uncaught typeerror",
        "uncaught referenceerror",
        "uncaught syntaxerror",
        "exception in thread",
        "internal server error",
        "application error",
        "404 not found",
        "page not found",
        "there isn't a github pages site here"
    );

    @Inject PageFetcher pageFetcher;
    @Inject CheckMatcher checkMatcher;
    @Inject EvidenceExtractor extractor;

    @Value("${live.fetch-timeout:10s}")
    Duration fetchTimeout;

    public LiveResult validate(String url, List<CheckSpec> checks) {
        log.info("Validating deployed page: {}", url);
        FetchResult fetch = pageFetcher.fetch(url, fetchTimeout);
        String body = fetch.body() != null ? fetch.body() : "";
        PageInfo info = PageInfo.of(fetch.statusCode(), fetch.elapsedMs(),
            body.getBytes(StandardCharsets.UTF_8).length);

        if (!fetch.reachedServer()) {
            return LiveResult.failed(url, info,
                fetch.error() != null ? fetch.error() : "Failed to fetch page");
        }
        if (!fetch.success()) {
            return LiveResult.failed(url, info, "Page returned HTTP " + fetch.statusCode());
        }
        if (body.isBlank()) {
            return LiveResult.failed(url, info, "Page returned an empty body");
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (info.htmlSizeBytes() < MIN_HTML_BYTES) {
            warnings.add("Page HTML is very short (" + info.htmlSizeBytes() + " bytes)");
        }

        Document page = extractor.parseHtml(body);
        String title = page.title().isBlank() ? null : page.title();
        info = info.withStructure(title, page.select("script").size(), page.select("link").size());

        Evidence evidence = Evidence.ofLivePage(page);
        List<CheckResult> results = new ArrayList<>();
        for (CheckSpec spec : checks) {
            Optional<CheckResult> result = checkMatcher.matchLive(spec, evidence);
            result.ifPresent(r -> {
                results.add(r);
                if (!r.passed()) {
                    errors.add("Live check failed: " + r.spec().rawText() + ": " + r.detail());
                }
            });
        }

        String text = extractor.renderedText(page);
        for (String marker : ERROR_MARKERS) {
            if (text.contains(marker)) {
                warnings.add("Page text contains error marker '" + marker + "'");
            }
        }

        log.info("Live page validation: {} errors, {} warnings", errors.size(), warnings.size());
        return LiveResult.of(url, info, results, errors, warnings);
    }
}
