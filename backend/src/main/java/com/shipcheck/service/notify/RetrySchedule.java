package com.shipcheck.service.notify;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fixed exponential backoff: 1, 2, 4, 8, 16 seconds between attempts,
 * so at most six attempts in total.
 */
public final class RetrySchedule {

    static final List<Integer> STANDARD_DELAYS_SECONDS = List.of(1, 2, 4, 8, 16);

    private final List<Duration> delays;

    RetrySchedule(List<Duration> delays) {
        this.delays = List.copyOf(delays);
    }

    public static RetrySchedule standard() {
        return new RetrySchedule(STANDARD_DELAYS_SECONDS.stream().map(Duration::ofSeconds).toList());
    }

    public int maxAttempts() {
        return delays.size() + 1;
    }

    /** Wait before the attempt that follows failed attempt {@code attemptNumber}; empty once exhausted. */
    public Optional<Duration> delayAfter(int attemptNumber) {
        if (attemptNumber < 1 || attemptNumber > delays.size()) return Optional.empty();
        return Optional.of(delays.get(attemptNumber - 1));
    }
}
