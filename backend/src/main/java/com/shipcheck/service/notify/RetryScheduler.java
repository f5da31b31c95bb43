package com.shipcheck.service.notify;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Timer behind the notification retry state machine. Actions run on a
 * scheduler thread, never on the caller's.
 *
 * The production implementation is {@link DefaultRetryScheduler}.
 */
@FunctionalInterface
public interface RetryScheduler {

    ScheduledFuture<?> schedule(Duration delay, Runnable action);
}
