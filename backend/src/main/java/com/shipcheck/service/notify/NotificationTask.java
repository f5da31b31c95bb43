package com.shipcheck.service.notify;

import com.shipcheck.dto.NotificationPayload;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of one notification, owned by {@link NotificationDispatcher}.
 * State changes go through {@link #advance} so only table-approved
 * transitions happen.
 */
final class NotificationTask {

    private final String key;
    private final String taskId;
    private final String callbackUrl;
    private final NotificationPayload payload;
    private final List<NotificationAttempt> attempts = new ArrayList<>();
    private final CompletableFuture<NotificationOutcome> completion = new CompletableFuture<>();

    private NotificationState state = NotificationState.PENDING;
    private ScheduledFuture<?> pending;

    NotificationTask(String taskId, String callbackUrl, NotificationPayload payload) {
        this.key = taskId + "#" + UUID.randomUUID();
        this.taskId = taskId;
        this.callbackUrl = callbackUrl;
        this.payload = payload;
    }

    /**
     * Move to {@code next}. Returns false when the task already reached a
     * terminal state (it was cancelled meanwhile).
     *
     * @throws IllegalStateException for a transition the table does not allow
     */
    synchronized boolean advance(NotificationState next) {
        if (state.isTerminal()) return false;
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Notification " + taskId + ": " + state + " -> " + next);
        }
        state = next;
        return true;
    }

    synchronized NotificationState state() {
        return state;
    }

    synchronized void record(NotificationAttempt attempt) {
        attempts.add(attempt);
    }

    synchronized List<NotificationAttempt> attempts() {
        return List.copyOf(attempts);
    }

    synchronized void setPending(ScheduledFuture<?> future) {
        if (!state.isTerminal()) {
            pending = future;
        }
    }

    synchronized void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    void complete() {
        completion.complete(new NotificationOutcome(taskId, state(), attempts()));
    }

    String key() {
        return key;
    }

    String taskId() {
        return taskId;
    }

    String callbackUrl() {
        return callbackUrl;
    }

    NotificationPayload payload() {
        return payload;
    }

    CompletableFuture<NotificationOutcome> completion() {
        return completion;
    }
}
