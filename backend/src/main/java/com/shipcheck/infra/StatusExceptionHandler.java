package com.shipcheck.infra;

import com.shipcheck.dto.ErrorResponse;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import io.micronaut.http.server.exceptions.HttpStatusHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deliberate rejections thrown as {@link HttpStatusException} (bad credentials
 * on the build endpoint) rendered as {@link ErrorResponse}, code = status name.
 */
@Singleton
@Produces
@Replaces(HttpStatusHandler.class)
public class StatusExceptionHandler
    implements ExceptionHandler<HttpStatusException, HttpResponse<ErrorResponse>> {

    private static final Logger log = LoggerFactory.getLogger(StatusExceptionHandler.class);

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, HttpStatusException e) {
        log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getPath(), e.getStatus(), e.getMessage());
        return HttpResponse
            .<ErrorResponse>status(e.getStatus())
            .body(new ErrorResponse(e.getMessage(), e.getStatus().name()));
    }
}
