package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.Optional;

@Singleton
public class MitLicenseEvaluator implements CheckEvaluator {

    static final String LICENSE = "LICENSE";

    @Inject EvidenceExtractor extractor;

    @Override
    public CheckCategory category() {
        return CheckCategory.MIT_LICENSE;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        Optional<String> license = extractor.findRequiredFile(evidence.files(), LICENSE);
        if (license.isEmpty()) {
            return CheckResult.fail(spec, category(), "LICENSE file missing");
        }
        if (extractor.isEmpty(license.get())) {
            return CheckResult.fail(spec, category(), "LICENSE file is empty");
        }
        if (extractor.licenseIsMit(license.get())) {
            return CheckResult.pass(spec, category(), "MIT License text found in LICENSE");
        }
        return CheckResult.fail(spec, category(), "LICENSE exists but does not appear to be MIT");
    }
}
