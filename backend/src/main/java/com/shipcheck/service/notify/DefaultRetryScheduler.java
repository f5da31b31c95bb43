package com.shipcheck.service.notify;

import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link RetryScheduler} on Micronaut's shared scheduled executor.
 */
@Singleton
public class DefaultRetryScheduler implements RetryScheduler {

    @Inject
    @Named(TaskExecutors.SCHEDULED)
    TaskScheduler taskScheduler;

    @Override
    public ScheduledFuture<?> schedule(Duration delay, Runnable action) {
        return taskScheduler.schedule(delay, action);
    }
}
