package com.shipcheck.domain;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

/**
 * Snapshot of one live page fetch. {@code statusCode} is -1 when no HTTP
 * response was received at all.
 */
@Serdeable
public record PageInfo(
    int statusCode,
    long responseTimeMs,
    long htmlSizeBytes,
    @Nullable String title,
    int scriptCount,
    int linkCount
) {

    public static PageInfo of(int statusCode, long responseTimeMs, long htmlSizeBytes) {
        return new PageInfo(statusCode, responseTimeMs, htmlSizeBytes, null, 0, 0);
    }

    public PageInfo withStructure(@Nullable String title, int scriptCount, int linkCount) {
        return new PageInfo(statusCode, responseTimeMs, htmlSizeBytes, title, scriptCount, linkCount);
    }
}
