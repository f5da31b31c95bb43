package com.shipcheck;

import com.shipcheck.dto.HealthResponse;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.assertj.core.api.AssertionsForClassTypes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class HealthControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Test
    void health_returnsHealthy() {
        HttpResponse<HealthResponse> response = client.toBlocking().exchange(
            HttpRequest.GET("/health"), HealthResponse.class);

        AssertionsForClassTypes.assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get()).isEqualTo(new HealthResponse("healthy", "1.0.0"));
    }

    @Test
    void root_returnsSameStatus() {
        HealthResponse body = client.toBlocking().retrieve(HttpRequest.GET("/"), HealthResponse.class);

        assertThat(body.status()).isEqualTo("healthy");
    }
}
