package com.shipcheck.infra;

import com.shipcheck.dto.ErrorResponse;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-resort handler: anything no narrower handler claims becomes a 500
 * with a fixed message, so internal details never reach the caller.
 * Rejected credentials and invalid bodies are shaped by
 * {@link StatusExceptionHandler} and {@link ConstraintViolationHandler}.
 */
@Singleton
@Produces
public class GlobalExceptionHandler
    implements ExceptionHandler<Exception, HttpResponse<ErrorResponse>> {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, Exception e) {
        log.error("✗ {} {} failed: {}", request.getMethod(), request.getPath(), e.getMessage(), e);
        return HttpResponse
            .<ErrorResponse>status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Internal server error", INTERNAL_ERROR));
    }
}
