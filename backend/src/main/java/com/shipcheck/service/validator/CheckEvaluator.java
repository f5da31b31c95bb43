package com.shipcheck.service.validator;

import com.shipcheck.domain.CheckCategory;
import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.CheckSpec;

/**
 * Category-specific verdict for one check.
 *
 * Implementations:
 *   MitLicenseEvaluator: LICENSE mentions MIT
 *   ReadmeQualityEvaluator: README length and heading floor
 *   ElementIdEvaluator: element with the requested id exists in the page
 *   CdnScriptEvaluator: library (optionally a version) loaded from a CDN
 *   ArithmeticEvaluator: scripts define functions and do arithmetic
 *   GenericKeywordEvaluator: keyword fallback, low confidence
 *
 * Missing evidence is a failed result, never an exception.
 */
public interface CheckEvaluator {

    CheckCategory category();

    /**
     * @param spec     the check being evaluated
     * @param evidence files and parsed page to evaluate against
     * @return         verdict with a non-blank detail line
     */
    CheckResult evaluate(CheckSpec spec, Evidence evidence);
}
