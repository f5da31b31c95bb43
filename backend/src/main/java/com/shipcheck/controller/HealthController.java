package com.shipcheck.controller;

import com.shipcheck.dto.HealthResponse;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@Controller
@Tag(name = "health")
public class HealthController {

    static final String VERSION = "1.0.0";

    @Get
    @Operation(summary = "Service status")
    public HttpResponse<HealthResponse> root() {
        return HttpResponse.ok(new HealthResponse("healthy", VERSION));
    }

    @Get("/health")
    @Operation(summary = "Health check")
    public HttpResponse<HealthResponse> health() {
        return HttpResponse.ok(new HealthResponse("healthy", VERSION));
    }
}
