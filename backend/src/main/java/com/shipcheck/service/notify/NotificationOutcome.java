package com.shipcheck.service.notify;

import java.util.List;

/**
 * Terminal result of a notification: SUCCESS or ABANDONED plus every attempt made.
 */
public record NotificationOutcome(String taskId, NotificationState state, List<NotificationAttempt> attempts) {

    public NotificationOutcome {
        attempts = List.copyOf(attempts);
    }

    public boolean delivered() {
        return state == NotificationState.SUCCESS;
    }
}
