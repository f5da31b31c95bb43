package com.shipcheck.dto;

import com.shipcheck.domain.CheckResult;
import com.shipcheck.domain.PageInfo;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "Checks against the published page")
public record LiveResult(
    boolean passed,
    String url,
    PageInfo pageInfo,
    List<CheckResult> checks,
    List<String> errors,
    List<String> warnings
) {

    public LiveResult {
        checks = List.copyOf(checks);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static LiveResult of(String url, PageInfo pageInfo, List<CheckResult> checks,
                                List<String> errors, List<String> warnings) {
        return new LiveResult(errors.isEmpty(), url, pageInfo, checks, errors, warnings);
    }

    /** Fetch or stage failure: nothing beyond the page snapshot was checked. */
    public static LiveResult failed(String url, PageInfo pageInfo, String error) {
        return new LiveResult(false, url, pageInfo, List.of(), List.of(error), List.of());
    }
}
