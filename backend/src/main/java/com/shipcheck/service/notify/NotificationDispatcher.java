package com.shipcheck.service.notify;

import com.shipcheck.dto.NotificationPayload;
import com.shipcheck.dto.ValidationReport;
import com.shipcheck.infra.OutboundHttp;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers a task's result to its callback URL.
 *
 * Each notification is a small state machine (see {@link NotificationState})
 * driven by the {@link RetryScheduler}: one POST per attempt, 2xx ends in
 * SUCCESS, anything else waits 1, 2, 4, 8, 16 seconds between attempts and
 * ends in ABANDONED after the sixth failure. Waits are scheduled, never slept,
 * so one slow callback does not hold up other tasks.
 *
 * Failures are logged for operators only; the caller that submitted the build
 * already had its response.
 */
@Singleton
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    @Inject CallbackSender callbackSender;
    @Inject RetryScheduler retryScheduler;

    @Value("${notification.timeout:15s}")
    Duration timeout;

    private final RetrySchedule schedule = RetrySchedule.standard();

    /** In-flight notifications by task key, for shutdown cancellation. */
    private final Map<String, NotificationTask> inFlight = new ConcurrentHashMap<>();

    /**
     * Start delivering {@code payload}. Returns at once; the future completes
     * with SUCCESS or ABANDONED and never completes exceptionally.
     */
    public CompletableFuture<NotificationOutcome> dispatch(String taskId, String callbackUrl,
                                                           NotificationPayload payload) {
        NotificationTask task = new NotificationTask(taskId, callbackUrl, payload);

        if (OutboundHttp.parse(callbackUrl) == null) {
            log.error("✗ Notification for task {} abandoned: malformed callback URL '{}'", taskId, callbackUrl);
            task.advance(NotificationState.ABANDONED);
            task.complete();
            return task.completion();
        }

        inFlight.put(task.key(), task);
        scheduleAttempt(task, 1, Duration.ZERO);
        return task.completion();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Cancel pending retry waits. Reports that never got delivered are logged
     * in full so they can be recovered from the log.
     */
    @PreDestroy
    public void shutdown() {
        List<NotificationTask> tasks = new ArrayList<>(inFlight.values());
        for (NotificationTask task : tasks) {
            task.cancelPending();
            if (task.advance(NotificationState.ABANDONED)) {
                log.error("✗ Notification for task {} abandoned on shutdown after {} attempts; undelivered report: {}",
                    task.taskId(), task.attempts().size(), summarize(task.payload()));
                finish(task);
            }
        }
    }

    // ── State machine ───────────────────────────────────────────────────────

    private void scheduleAttempt(NotificationTask task, int attemptNumber, Duration delay) {
        try {
            task.setPending(retryScheduler.schedule(delay, () -> attempt(task, attemptNumber, delay)));
        } catch (Exception e) {
            log.error("✗ Notification for task {} abandoned: cannot schedule attempt {}: {}",
                task.taskId(), attemptNumber, e.getMessage());
            if (task.advance(NotificationState.ABANDONED)) {
                finish(task);
            }
        }
    }

    private void attempt(NotificationTask task, int attemptNumber, Duration delay) {
        try {
            if (!task.advance(NotificationState.ATTEMPTING)) return;

            DeliveryResult result = send(task);
            if (result.success()) {
                task.record(new NotificationAttempt(attemptNumber, delay.toSeconds(),
                    AttemptOutcome.SUCCESS, result.statusCode(), result.describe()));
                if (task.advance(NotificationState.SUCCESS)) {
                    log.info("✓ Notification for task {} delivered on attempt {}", task.taskId(), attemptNumber);
                    finish(task);
                }
                return;
            }

            Optional<Duration> next = schedule.delayAfter(attemptNumber);
            if (next.isEmpty()) {
                task.record(new NotificationAttempt(attemptNumber, delay.toSeconds(),
                    AttemptOutcome.ABANDONED, result.statusCode(), result.describe()));
                if (task.advance(NotificationState.ABANDONED)) {
                    log.error("✗ Notification for task {} abandoned after {} attempts, last: {}; undelivered report: {}",
                        task.taskId(), attemptNumber, result.describe(), summarize(task.payload()));
                    finish(task);
                }
                return;
            }

            task.record(new NotificationAttempt(attemptNumber, delay.toSeconds(),
                AttemptOutcome.TRANSIENT_FAILURE, result.statusCode(), result.describe()));
            if (task.advance(NotificationState.RETRYING)) {
                log.warn("Notification attempt {}/{} for task {} failed ({}), retrying in {}s",
                    attemptNumber, schedule.maxAttempts(), task.taskId(), result.describe(), next.get().toSeconds());
                scheduleAttempt(task, attemptNumber + 1, next.get());
            }

        } catch (Exception e) {
            log.error("✗ Notification for task {} abandoned after internal error: {}", task.taskId(), e.toString(), e);
            if (task.advance(NotificationState.ABANDONED)) {
                finish(task);
            }
        }
    }

    private DeliveryResult send(NotificationTask task) {
        try {
            return callbackSender.post(task.callbackUrl(), task.payload(), timeout);
        } catch (Exception e) {
            return DeliveryResult.networkError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void finish(NotificationTask task) {
        inFlight.remove(task.key());
        task.complete();
    }

    private static String summarize(NotificationPayload payload) {
        if (payload == null) return "none";
        ValidationReport report = payload.validation();
        if (report == null) return "repo=" + payload.repoUrl();
        return String.format("repo=%s commit=%s static=%s checks=%d/%d live=%s",
            payload.repoUrl(), payload.commitSha(),
            report.staticResult().passed() ? "passed" : "failed",
            report.checksResult().passedCount(), report.checksResult().totalCount(),
            report.hasLiveResult() ? (report.liveResult().passed() ? "passed" : "failed") : "not run");
    }
}
