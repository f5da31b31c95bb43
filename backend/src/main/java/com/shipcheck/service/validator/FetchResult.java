package com.shipcheck.service.validator;

import jakarta.annotation.Nullable;

/**
 * Result of one page fetch by {@link PageFetcher}.
 *
 * @param statusCode HTTP status, or -1 when no response arrived (timeout, refused, bad URL)
 * @param body       response body, empty when none
 * @param elapsedMs  wall time spent on the request
 * @param error      transport-level error description when {@code statusCode} is -1
 */
public record FetchResult(int statusCode, String body, long elapsedMs, @Nullable String error) {

    public static FetchResult networkError(String error, long elapsedMs) {
        return new FetchResult(-1, "", elapsedMs, error);
    }

    public boolean success() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean reachedServer() {
        return statusCode >= 0;
    }
}
