package com.shipcheck.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

@Serdeable
@Schema(description = "Service health")
public record HealthResponse(String status, String version) {}
