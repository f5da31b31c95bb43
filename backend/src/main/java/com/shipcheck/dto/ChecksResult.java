package com.shipcheck.dto;

import com.shipcheck.domain.CheckResult;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Serdeable
@Schema(description = "Per-check verdicts, in the order the checks were supplied")
public record ChecksResult(
    List<CheckResult> results,
    int passedCount,
    int totalCount
) {

    public ChecksResult {
        results = List.copyOf(results);
    }

    public static ChecksResult of(List<CheckResult> results) {
        int passed = (int) results.stream().filter(CheckResult::passed).count();
        return new ChecksResult(results, passed, results.size());
    }

    public boolean allPassed() {
        return passedCount == totalCount;
    }

    /** First verdict recorded for the given check text. */
    public Optional<CheckResult> resultFor(String checkText) {
        return Optional.ofNullable(byCheckText().get(checkText));
    }

    /** Verdicts keyed by check text; duplicate texts collapse to their first entry. */
    public Map<String, CheckResult> byCheckText() {
        Map<String, CheckResult> keyed = new LinkedHashMap<>();
        for (CheckResult r : results) {
            keyed.putIfAbsent(r.spec().rawText(), r);
        }
        return keyed;
    }
}
