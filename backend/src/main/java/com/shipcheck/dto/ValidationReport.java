package com.shipcheck.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

/**
 * Cumulative, advisory validation report. Each stage returns a new instance
 * with its section filled in; {@code liveResult} stays null when live
 * validation could not run.
 */
@Serdeable
@Schema(description = "Validation report attached to the evaluation notification")
public record ValidationReport(
    StaticResult staticResult,
    ChecksResult checksResult,
    @Nullable LiveResult liveResult
) {

    public ValidationReport withLive(LiveResult live) {
        return new ValidationReport(staticResult, checksResult, live);
    }

    public boolean hasLiveResult() {
        return liveResult != null;
    }

    /** True when every section that ran passed. */
    public boolean passed() {
        return staticResult.passed()
            && checksResult.allPassed()
            && (liveResult == null || liveResult.passed());
    }
}
