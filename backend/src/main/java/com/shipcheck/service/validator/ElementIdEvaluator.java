package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jsoup.nodes.Document;

import java.util.Optional;

@Singleton
public class ElementIdEvaluator implements CheckEvaluator {

    @Inject EvidenceExtractor extractor;

    @Override
    public CheckCategory category() {
        return CheckCategory.HTML_ELEMENT_BY_ID;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        Optional<String> id = CheckClassifier.extractElementId(spec.rawText());
        if (id.isEmpty()) {
            return CheckResult.fail(spec, category(), "Could not extract an element id from the check text");
        }
        if (evidence.page().isEmpty()) {
            return CheckResult.fail(spec, category(),
                evidence.pageSource() + " missing, cannot look up id='" + id.get() + "'");
        }

        Document page = evidence.page().get();
        ElementMatch match = extractor.findElementById(page, id.get());
        if (match.found()) {
            return CheckResult.pass(spec, category(), String.format(
                "Element with id='%s' found in %s (<%s> tag)",
                id.get(), evidence.pageSource(), match.tagName().orElse("?")));
        }
        return CheckResult.fail(spec, category(),
            "Element with id='" + id.get() + "' NOT found in " + evidence.pageSource());
    }
}
