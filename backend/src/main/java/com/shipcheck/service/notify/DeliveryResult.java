package com.shipcheck.service.notify;

import jakarta.annotation.Nullable;

/**
 * Result of one callback POST by {@link CallbackSender}.
 *
 * @param statusCode HTTP status, or -1 when no response arrived
 */
public record DeliveryResult(int statusCode, @Nullable String error) {

    public static DeliveryResult status(int statusCode) {
        return new DeliveryResult(statusCode, null);
    }

    public static DeliveryResult networkError(String error) {
        return new DeliveryResult(-1, error);
    }

    public boolean success() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String describe() {
        return statusCode >= 0 ? "HTTP " + statusCode : (error != null ? error : "no response");
    }
}
