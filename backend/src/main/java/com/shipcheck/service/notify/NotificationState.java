package com.shipcheck.service.notify;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Delivery state of one task's notification.
 *
 *   PENDING → ATTEMPTING → SUCCESS
 *                        → RETRYING → ATTEMPTING
 *                        → ABANDONED
 *
 * PENDING and RETRYING may also go straight to ABANDONED (malformed callback
 * URL, shutdown while waiting).
 */
public enum NotificationState {
    PENDING,
    ATTEMPTING,
    RETRYING,
    SUCCESS,
    ABANDONED;

    private static final Map<NotificationState, Set<NotificationState>> TRANSITIONS =
        new EnumMap<>(NotificationState.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ATTEMPTING, ABANDONED));
        TRANSITIONS.put(ATTEMPTING, EnumSet.of(SUCCESS, RETRYING, ABANDONED));
        TRANSITIONS.put(RETRYING, EnumSet.of(ATTEMPTING, ABANDONED));
        TRANSITIONS.put(SUCCESS, EnumSet.noneOf(NotificationState.class));
        TRANSITIONS.put(ABANDONED, EnumSet.noneOf(NotificationState.class));
    }

    public boolean canTransitionTo(NotificationState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
