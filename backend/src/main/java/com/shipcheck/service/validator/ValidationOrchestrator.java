package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import com.shipcheck.domain.FileSet;
import com.shipcheck.domain.PageInfo;
import com.shipcheck.dto.ChecksResult;
import com.shipcheck.dto.LiveResult;
import com.shipcheck.dto.StaticResult;
import com.shipcheck.dto.ValidationReport;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs Static → Requirements → Live and accumulates one {@link ValidationReport}.
 *
 * Validation is advisory: no method here throws. A fault inside a stage is
 * recorded in that stage's section and the next stage still runs, so the
 * publishing pipeline always gets a complete report back.
 */
@Singleton
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    @Inject StaticValidator staticValidator;
    @Inject CheckMatcher checkMatcher;
    @Inject LiveValidator liveValidator;
    @Inject EvidenceExtractor extractor;
    @Inject ValidationLog validationLog;

    /** Static and requirements stages over generated files, before publishing. */
    public ValidationReport validateGenerated(FileSet files, List<String> checks) {
        List<CheckSpec> specs = toSpecs(checks);
        FileSet safeFiles = files != null ? files : FileSet.empty();

        validationLog.stage("Static Files");
        StaticResult staticResult = runStatic(safeFiles);
        validationLog.staticResult(staticResult);

        validationLog.stage("Requirements (" + specs.size() + " checks)");
        ChecksResult checksResult = runChecks(safeFiles, specs);
        validationLog.checks(checksResult);

        return new ValidationReport(staticResult, checksResult, null);
    }

    /**
     * Report for a task whose generator failed: static hard-fails and every
     * check fails against an empty file set.
     */
    public ValidationReport validateGenerationFailure(String reason, List<String> checks) {
        List<CheckSpec> specs = toSpecs(checks);

        validationLog.stage("Static Files");
        StaticResult staticResult = staticValidator.noFiles(reason);
        validationLog.staticResult(staticResult);

        validationLog.stage("Requirements (" + specs.size() + " checks)");
        ChecksResult checksResult = runChecks(FileSet.empty(), specs);
        validationLog.checks(checksResult);

        return new ValidationReport(staticResult, checksResult, null);
    }

    /**
     * Live stage. Without a published URL the report is returned unchanged
     * and {@code liveResult} stays absent.
     */
    public ValidationReport validateLive(ValidationReport report, String pagesUrl, List<String> checks) {
        if (pagesUrl == null || pagesUrl.isBlank()) {
            log.info("No published URL, live validation skipped");
            return report;
        }

        validationLog.stage("Live Page");
        LiveResult live;
        try {
            live = liveValidator.validate(pagesUrl, toSpecs(checks));
        } catch (Exception e) {
            log.warn("Live validation fault for {}: {}", pagesUrl, e.toString());
            live = LiveResult.failed(pagesUrl, PageInfo.of(-1, 0, 0),
                "Live validation fault: " + describe(e));
        }
        validationLog.live(live);
        return report.withLive(live);
    }

    /** Full run: pre-publish stages, then live when a URL is given. */
    public ValidationReport validate(FileSet files, List<String> checks, String pagesUrl) {
        ValidationReport report = validateLive(validateGenerated(files, checks), pagesUrl, checks);
        complete(report);
        return report;
    }

    public void complete(ValidationReport report) {
        validationLog.complete(report);
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private StaticResult runStatic(FileSet files) {
        try {
            return staticValidator.validate(files);
        } catch (Exception e) {
            log.warn("Static validation fault: {}", e.toString());
            return StaticResult.failed("Static validation fault: " + describe(e));
        }
    }

    private ChecksResult runChecks(FileSet files, List<CheckSpec> specs) {
        try {
            Evidence evidence = Evidence.ofFiles(files, extractor);
            return ChecksResult.of(checkMatcher.matchAll(specs, evidence));
        } catch (Exception e) {
            log.warn("Requirements validation fault: {}", e.toString());
            List<CheckResult> failed = new ArrayList<>(specs.size());
            for (CheckSpec spec : specs) {
                failed.add(CheckResult.fail(spec, CheckCategory.GENERIC,
                    "Requirements stage fault: " + describe(e)));
            }
            return ChecksResult.of(failed);
        }
    }

    static List<CheckSpec> toSpecs(List<String> checks) {
        if (checks == null) return List.of();
        List<CheckSpec> specs = new ArrayList<>(checks.size());
        for (String text : checks) {
            specs.add(new CheckSpec(text != null ? text : ""));
        }
        return specs;
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
