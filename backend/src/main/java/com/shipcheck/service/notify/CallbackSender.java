package com.shipcheck.service.notify;

import java.time.Duration;

/**
 * HTTP POST capability for the notification dispatcher.
 *
 * The production implementation is {@link HttpCallbackSender}.
 * Tests replace this with a {@code @MockBean}.
 */
@FunctionalInterface
public interface CallbackSender {

    /**
     * POST a JSON payload. Network failures come back as status -1.
     *
     * @param url     absolute callback URL
     * @param payload object serialized as the JSON body
     * @param timeout read timeout for the request
     */
    DeliveryResult post(String url, Object payload, Duration timeout);
}
