package com.shipcheck.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shipcheck.service.collaborator.Deployment;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "Result posted to the requester's callback URL")
public record NotificationPayload(
    String email,
    String task,
    int round,
    String nonce,
    @JsonProperty("repo_url") @Nullable String repoUrl,
    @JsonProperty("commit_sha") @Nullable String commitSha,
    @JsonProperty("pages_url") @Nullable String pagesUrl,
    ValidationReport validation
) {

    public static NotificationPayload of(BuildRequest request, Deployment deployment, ValidationReport report) {
        return new NotificationPayload(
            request.email(),
            request.task(),
            request.round(),
            request.nonce(),
            deployment.repoUrl(),
            deployment.commitSha(),
            deployment.pagesUrl(),
            report
        );
    }

    /** Payload for a request that never reached a deployment; repo and pages fields stay null. */
    public static NotificationPayload undeployed(BuildRequest request, ValidationReport report) {
        return new NotificationPayload(
            request.email(),
            request.task(),
            request.round(),
            request.nonce(),
            null,
            null,
            null,
            report
        );
    }
}
