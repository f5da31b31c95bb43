package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;

@Singleton
public class ArithmeticEvaluator implements CheckEvaluator {

    @Inject EvidenceExtractor extractor;

    @Override
    public CheckCategory category() {
        return CheckCategory.ARITHMETIC_OPERATIONS;
    }

    @Override
    public CheckResult evaluate(CheckSpec spec, Evidence evidence) {
        String scripts = extractor.scriptSources(evidence.files());
        if (scripts.isBlank()) {
            return CheckResult.fail(spec, category(), "No script code found in generated files (heuristic)");
        }
        if (extractor.detectArithmeticCode(scripts)) {
            return CheckResult.pass(spec, category(),
                "Scripts define functions and use arithmetic operators (heuristic)");
        }

        String code = extractor.stripCommentsAndStrings(scripts);
        List<String> missing = new ArrayList<>();
        if (!extractor.hasFunctionDefinition(code)) missing.add("no functions");
        if (!extractor.hasArithmeticOperator(code)) missing.add("no arithmetic operators");
        return CheckResult.fail(spec, category(),
            "Code may not perform operations: " + String.join(", ", missing) + " (heuristic)");
    }
}
