package com.shipcheck.service.notify;

/**
 * One POST to the callback URL.
 *
 * @param attemptNumber         1-based
 * @param scheduledDelaySeconds wait before this attempt (0 for the first)
 * @param statusCode            HTTP status, -1 when no response arrived
 * @param detail                status line or transport error
 */
public record NotificationAttempt(
    int attemptNumber,
    long scheduledDelaySeconds,
    AttemptOutcome outcome,
    int statusCode,
    String detail
) {}
