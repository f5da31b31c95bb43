package com.shipcheck.controller;

import com.shipcheck.dto.BuildRequest;
import com.shipcheck.dto.BuildResponse;
import com.shipcheck.service.BuildTaskService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

@Controller("/api")
@Validated
@Tag(name = "build")
public class BuildController {

    @Inject
    BuildTaskService buildTaskService;

    @Post("/build")
    @Operation(summary = "Queue a build; the result is posted to evaluation_url")
    public HttpResponse<BuildResponse> build(@Valid @Body BuildRequest req) {
        return HttpResponse.ok(buildTaskService.accept(req));
    }
}
