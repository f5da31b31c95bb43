package com.shipcheck.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "File attached to a brief")
public record Attachment(
    @NotBlank
    @Schema(description = "File name")
    String name,

    @NotBlank
    @Schema(description = "Content as a data URI (data:mime/type;base64,...)")
    String url
) {}
