package com.shipcheck.service.notify;

import com.shipcheck.infra.OutboundHttp;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.client.exceptions.ReadTimeoutException;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Production {@link CallbackSender} on the Micronaut HTTP client.
 */
@Singleton
public class HttpCallbackSender implements CallbackSender {

    private static final Logger log = LoggerFactory.getLogger(HttpCallbackSender.class);

    @Override
    public DeliveryResult post(String url, Object payload, Duration timeout) {
        URI target = OutboundHttp.parse(url);
        if (target == null) {
            return DeliveryResult.networkError("Invalid callback URL: " + url);
        }

        try (HttpClient client = OutboundHttp.create(target, timeout)) {
            HttpResponse<String> response = client.toBlocking().exchange(
                HttpRequest.POST(OutboundHttp.pathOf(target), payload)
                    .contentType(MediaType.APPLICATION_JSON_TYPE),
                String.class);
            return DeliveryResult.status(response.getStatus().getCode());

        } catch (HttpClientResponseException e) {
            log.debug("Callback {} answered {}: {}", url, e.getStatus().getCode(), e.getMessage());
            return DeliveryResult.status(e.getStatus().getCode());

        } catch (ReadTimeoutException e) {
            return DeliveryResult.networkError("Callback timed out after " + timeout.toSeconds() + "s");

        } catch (Exception e) {
            return DeliveryResult.networkError("Callback failed: " + e.getMessage());
        }
    }
}
