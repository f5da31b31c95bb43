package com.shipcheck.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

@Serdeable
@Schema(description = "Immediate acknowledgement of a build request")
public record BuildResponse(String status, String message) {}
