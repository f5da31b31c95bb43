package com.shipcheck.domain;

import io.micronaut.serde.annotation.Serdeable;

import java.util.Objects;

/**
 * Verdict for a single check. The detail line is mandatory even on pass.
 */
@Serdeable
public record CheckResult(
    CheckSpec spec,
    CheckCategory category,
    boolean passed,
    String detail
) {

    public CheckResult {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(category, "category");
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException(
                "Check result for '" + spec.rawText() + "' has no detail");
        }
    }

    public static CheckResult pass(CheckSpec spec, CheckCategory category, String detail) {
        return new CheckResult(spec, category, true, detail);
    }

    public static CheckResult fail(CheckSpec spec, CheckCategory category, String detail) {
        return new CheckResult(spec, category, false, detail);
    }
}
