package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.Optional;

/**
 * Library-from-CDN check. Only Bootstrap is classified into this category.
 */
@Singleton
public class CdnScriptEvaluator implements CheckEvaluator {

    static final String LIBRARY = "bootstrap";
    private static final String DISPLAY_NAME = "Bootstrap";

    @Inject EvidenceExtractor extractor;

    @Override
    public CheckCategory category() {
        return CheckCategory.CDN_SCRIPT_PRESENCE;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        Optional<String> version = CheckClassifier.extractVersion(spec.rawText());
        String wanted = DISPLAY_NAME + version.map(v -> " " + v).orElse("");

        if (evidence.page().isEmpty()) {
            return CheckResult.fail(spec, category(),
                evidence.pageSource() + " missing, cannot look for " + wanted + " CDN link");
        }

        CdnMatch match = extractor.findCdnLink(evidence.page().get(), LIBRARY, version.orElse(null));
        if (match.found()) {
            String loaded = DISPLAY_NAME + match.matchedVersion().map(v -> " " + v).orElse("");
            return CheckResult.pass(spec, category(),
                loaded + " CDN link found: " + match.url().orElse("?"));
        }
        if (match.url().isPresent()) {
            return CheckResult.fail(spec, category(), String.format(
                "%s CDN link found but version %s does not match requested %s",
                DISPLAY_NAME, match.matchedVersion().orElse("unknown"), version.orElse("?")));
        }
        return CheckResult.fail(spec, category(),
            "No " + wanted + " CDN link found in " + evidence.pageSource());
    }
}
