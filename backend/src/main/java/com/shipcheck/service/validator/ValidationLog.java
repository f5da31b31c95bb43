package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckResult;
import com.shipcheck.dto.ChecksResult;
import com.shipcheck.dto.LiveResult;
import com.shipcheck.dto.StaticResult;
import com.shipcheck.dto.ValidationReport;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator-facing validation log. Log scrapers depend on this exact shape:
 *
 *   ============================================================
 *   VALIDATION: Static Files
 *   ============================================================
 *     ✓ Repo has MIT license: MIT License text found in LICENSE
 *   Checks validation summary: 3/3 passed
 *   ============================================================
 *   VALIDATION COMPLETE
 *   ============================================================
 */
@Singleton
public class ValidationLog {

    private static final Logger log = LoggerFactory.getLogger(ValidationLog.class);

    public static final String BANNER = "=".repeat(60);
    static final String PASS = "✓";
    static final String FAIL = "✗";
    static final String WARN = "⚠";

    public void stage(String name) {
        log.info(BANNER);
        log.info("VALIDATION: {}", name);
        log.info(BANNER);
    }

    public void staticResult(StaticResult result) {
        result.errors().forEach(e -> log.info("  {} {}", FAIL, e));
        result.warnings().forEach(w -> log.info("  {} {}", WARN, w));
        log.info("Static validation {}", result.passed() ? "passed" : "failed");
    }

    public void checks(ChecksResult result) {
        result.results().forEach(r -> log.info(checkLine(r)));
        log.info(summaryLine(result));
    }

    public void live(LiveResult result) {
        result.checks().forEach(r -> log.info(checkLine(r)));
        result.errors().forEach(e -> log.info("  {} {}", FAIL, e));
        result.warnings().forEach(w -> log.info("  {} {}", WARN, w));
        log.info("Live validation {} (HTTP {}, {}ms, {} bytes)",
            result.passed() ? "passed" : "failed",
            result.pageInfo().statusCode(),
            result.pageInfo().responseTimeMs(),
            result.pageInfo().htmlSizeBytes());
    }

    public void complete(ValidationReport report) {
        log.info(BANNER);
        log.info("VALIDATION COMPLETE");
        log.info(BANNER);
        log.info("Static: {}, checks: {}/{} passed, live: {}",
            report.staticResult().passed() ? "passed" : "failed",
            report.checksResult().passedCount(),
            report.checksResult().totalCount(),
            report.hasLiveResult() ? (report.liveResult().passed() ? "passed" : "failed") : "not run");
    }

    public static String checkLine(CheckResult result) {
        return "  " + (result.passed() ? PASS : FAIL) + " " + result.spec().rawText() + ": " + result.detail();
    }

    public static String summaryLine(ChecksResult result) {
        return "Checks validation summary: " + result.passedCount() + "/" + result.totalCount() + " passed";
    }
}
