package com.shipcheck.domain;

import io.micronaut.serde.annotation.Serdeable;

import java.util.Objects;

/**
 * One free-text acceptance check, exactly as the caller supplied it.
 * Two specs with the same text are the same check.
 */
@Serdeable
public record CheckSpec(String rawText) {

    public CheckSpec {
        Objects.requireNonNull(rawText, "rawText");
    }
}
