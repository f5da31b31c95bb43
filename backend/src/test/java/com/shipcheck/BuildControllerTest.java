package com.shipcheck;

import com.shipcheck.domain.FileSet;
import com.shipcheck.dto.BuildRequest;
import com.shipcheck.dto.BuildResponse;
import com.shipcheck.dto.ErrorResponse;
import com.shipcheck.service.collaborator.ArtifactGenerator;
import com.shipcheck.service.collaborator.ArtifactPublisher;
import com.shipcheck.service.notify.CallbackSender;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.assertj.core.api.AssertionsForClassTypes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@MicronautTest
class BuildControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject ArtifactGenerator generator;   // resolves to the mock below

    @MockBean(ArtifactGenerator.class)
    ArtifactGenerator mockGenerator() {
        return mock(ArtifactGenerator.class);
    }

    @MockBean(ArtifactPublisher.class)
    ArtifactPublisher mockPublisher() {
        return mock(ArtifactPublisher.class);
    }

    @MockBean(CallbackSender.class)
    CallbackSender mockSender() {
        return mock(CallbackSender.class);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private BuildRequest request(String task, String secret) {
        return new BuildRequest("student@example.com", secret, task, 1, "n-1",
            "Build a landing page", List.of("Repo has MIT license"),
            "https://evaluator.example.com/notify", null);
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void build_validCredentials_acceptedAndProcessedInBackground() {
        when(generator.generate(any())).thenReturn(FileSet.of(Map.of("index.html", "<html></html>")));

        HttpResponse<BuildResponse> response = client.toBlocking().exchange(
            HttpRequest.POST("/api/build", request("landing-1", "s3cret")),
            BuildResponse.class
        );

        AssertionsForClassTypes.assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get().status()).isEqualTo("accepted");
        verify(generator, timeout(5000)).generate(argThat(r -> r.task().equals("landing-1")));
    }

    @Test
    void build_checksAsSingleString_wrappedInList() {
        when(generator.generate(any())).thenReturn(FileSet.of(Map.of("index.html", "<html></html>")));
        Map<String, Object> body = Map.of(
            "email", "student@example.com",
            "secret", "s3cret",
            "task", "single-check",
            "round", 1,
            "nonce", "n-2",
            "brief", "Build a landing page",
            "checks", "Repo has MIT license",
            "evaluation_url", "https://evaluator.example.com/notify");

        HttpResponse<BuildResponse> response = client.toBlocking().exchange(
            HttpRequest.POST("/api/build", body),
            BuildResponse.class
        );

        AssertionsForClassTypes.assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
        verify(generator, timeout(5000)).generate(argThat(r ->
            r.task().equals("single-check") && r.checks().equals(List.of("Repo has MIT license"))));
    }

    @Test
    void build_wrongSecret_returns403() {
        assertThatThrownBy(() ->
            client.toBlocking().exchange(
                HttpRequest.POST("/api/build", request("landing-forbidden", "wrong")),
                BuildResponse.class
            )
        ).isInstanceOfSatisfying(HttpClientResponseException.class, ex -> {
            AssertionsForClassTypes.assertThat(ex.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
            ErrorResponse error = ex.getResponse().getBody(ErrorResponse.class).orElseThrow();
            assertThat(error.code()).isEqualTo("FORBIDDEN");
            assertThat(error.message()).isEqualTo("Invalid email or secret");
        });
        verify(generator, after(200).never()).generate(argThat(r -> r.task().equals("landing-forbidden")));
    }

    @Test
    void build_blankTask_returns400() {
        BuildRequest invalid = new BuildRequest("student@example.com", "s3cret", "", 1, "n-1",
            "brief", List.of(), "https://evaluator.example.com/notify", null);

        assertThatThrownBy(() ->
            client.toBlocking().exchange(HttpRequest.POST("/api/build", invalid), BuildResponse.class)
        ).isInstanceOfSatisfying(HttpClientResponseException.class, ex -> {
            AssertionsForClassTypes.assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
            ErrorResponse error = ex.getResponse().getBody(ErrorResponse.class).orElseThrow();
            assertThat(error.code()).isEqualTo("INVALID_REQUEST");
            assertThat(error.message()).contains("task: must not be blank");
        });
    }
}
