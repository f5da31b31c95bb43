package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies each check and dispatches it to its evaluator.
 *
 * Never throws: a fault inside one evaluator becomes a failed result naming
 * the fault, and the remaining checks are still evaluated.
 */
@Singleton
public class CheckMatcher {

    private static final Logger log = LoggerFactory.getLogger(CheckMatcher.class);

    @Inject CheckClassifier classifier;
    @Inject EvaluatorFactory evaluatorFactory;

    public CheckResult match(CheckSpec spec, Evidence evidence) {
        CheckCategory category = CheckCategory.GENERIC;
        try {
            category = classifier.classify(spec.rawText());
            return evaluate(spec, category, evidence);
        } catch (Exception e) {
            log.warn("Evaluator fault for check '{}': {}", spec.rawText(), e.toString());
            return faultResult(spec, category, e);
        }
    }

    /** Results in supplied order, one per spec, duplicates included. */
    public List<CheckResult> matchAll(List<CheckSpec> specs, Evidence evidence) {
        List<CheckResult> results = new ArrayList<>(specs.size());
        for (CheckSpec spec : specs) {
            results.add(match(spec, evidence));
        }
        return results;
    }

    /**
     * Evaluate a check against a live page, but only when its category can be
     * observed there; other categories yield empty.
     */
    public Optional<CheckResult> matchLive(CheckSpec spec, Evidence livePage) {
        CheckCategory category = CheckCategory.GENERIC;
        try {
            category = classifier.classify(spec.rawText());
            if (!category.isLiveObservable()) return Optional.empty();
            return Optional.of(evaluate(spec, category, livePage));
        } catch (Exception e) {
            log.warn("Live evaluator fault for check '{}': {}", spec.rawText(), e.toString());
            return Optional.of(faultResult(spec, category, e));
        }
    }

    private CheckResult evaluate(CheckSpec spec, CheckCategory category, Evidence evidence) {
        CheckResult result = evaluatorFactory.forCategory(category).evaluate(spec, evidence);
        if (result == null) {
            return CheckResult.fail(spec, category, "Internal evaluation fault: evaluator returned no result");
        }
        return result;
    }

    private CheckResult faultResult(CheckSpec spec, CheckCategory category, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : "no message";
        return CheckResult.fail(spec, category,
            "Internal evaluation fault: " + e.getClass().getSimpleName() + ": " + message);
    }
}
