package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Singleton
public class ReadmeQualityEvaluator implements CheckEvaluator {

    static final String README = "README.md";

    @Inject EvidenceExtractor extractor;

    @Override
    public CheckCategory category() {
        return CheckCategory.README_QUALITY;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        Optional<String> readme = extractor.findRequiredFile(evidence.files(), README);
        if (readme.isEmpty()) {
            return CheckResult.fail(spec, category(), "README.md missing");
        }

        ReadmeMetrics metrics = extractor.readmeQuality(readme.get());
        if (metrics.meetsFloor()) {
            return CheckResult.pass(spec, category(), String.format(
                "README meets quality floor (%d chars, %d headings)",
                metrics.length(), metrics.headingCount()));
        }

        List<String> issues = new ArrayList<>();
        if (metrics.tooShort()) {
            issues.add("too short (" + metrics.length() + " chars, need more than "
                + ReadmeMetrics.MIN_LENGTH + ")");
        }
        if (!metrics.hasHeadings()) {
            issues.add("missing headings");
        }
        return CheckResult.fail(spec, category(), "README quality issues: " + String.join(", ", issues));
    }
}
