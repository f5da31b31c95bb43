package com.shipcheck.service.notify;

public enum AttemptOutcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    ABANDONED
}
