package com.shipcheck.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "Structural checks over generated files")
public record StaticResult(
    boolean passed,
    List<String> errors,
    List<String> warnings
) {

    public StaticResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static StaticResult of(List<String> errors, List<String> warnings) {
        return new StaticResult(errors.isEmpty(), errors, warnings);
    }

    public static StaticResult failed(String error) {
        return new StaticResult(false, List.of(error), List.of());
    }
}
