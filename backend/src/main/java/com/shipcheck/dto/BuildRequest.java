package com.shipcheck.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Serdeable
@Schema(description = "Request to generate, publish and validate an artifact")
public record BuildRequest(
    @NotBlank
    @Schema(description = "Requester email, must match the configured one")
    String email,

    @NotBlank
    @Schema(description = "Shared secret")
    String secret,

    @NotBlank
    @Schema(description = "Task identifier, also used to name the repository")
    String task,

    @Min(1)
    @Schema(description = "Round number; later rounds update the existing repository")
    int round,

    @NotBlank
    @Schema(description = "Opaque value echoed back in the notification")
    String nonce,

    @NotBlank
    @Schema(description = "Natural-language brief for the generator")
    String brief,

    @NotNull
    @Serdeable.Deserializable(using = CheckListDeserializer.class)
    @Schema(description = "Free-text acceptance checks; a single string is read as one check")
    List<String> checks,

    @NotBlank
    @JsonProperty("evaluation_url")
    @Schema(description = "Callback URL that receives the result")
    String evaluationUrl,

    @Nullable
    @Valid
    @Schema(description = "Files attached to the brief")
    List<Attachment> attachments
) {

    public List<Attachment> attachmentsOrEmpty() {
        return attachments != null ? attachments : List.of();
    }
}
