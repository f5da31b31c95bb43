package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Selects the {@link CheckEvaluator} for a classified check.
 */
@Singleton
public class EvaluatorFactory {

    @Inject MitLicenseEvaluator mitLicenseEvaluator;
    @Inject ReadmeQualityEvaluator readmeQualityEvaluator;
    @Inject ElementIdEvaluator elementIdEvaluator;
    @Inject CdnScriptEvaluator cdnScriptEvaluator;
    @Inject ArithmeticEvaluator arithmeticEvaluator;
    @Inject GenericKeywordEvaluator genericKeywordEvaluator;

    public CheckEvaluator forCategory(CheckCategory category) {
        return switch (category) {
            case MIT_LICENSE           -> mitLicenseEvaluator;
            case README_QUALITY        -> readmeQualityEvaluator;
            case HTML_ELEMENT_BY_ID    -> elementIdEvaluator;
            case CDN_SCRIPT_PRESENCE   -> cdnScriptEvaluator;
            case ARITHMETIC_OPERATIONS -> arithmeticEvaluator;
            case GENERIC               -> genericKeywordEvaluator;
        };
    }
}
