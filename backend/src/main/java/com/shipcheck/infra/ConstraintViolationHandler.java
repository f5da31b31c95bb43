package com.shipcheck.infra;

import com.shipcheck.dto.ErrorResponse;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import io.micronaut.validation.exceptions.ConstraintExceptionHandler;
import jakarta.inject.Singleton;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;

import java.util.stream.Collectors;

/** Bean-validation failures on a request body → 400 listing each offending field. */
@Singleton
@Produces
@Replaces(ConstraintExceptionHandler.class)
public class ConstraintViolationHandler
    implements ExceptionHandler<ConstraintViolationException, HttpResponse<ErrorResponse>> {

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, ConstraintViolationException e) {
        String fields = e.getConstraintViolations().stream()
            .map(ConstraintViolationHandler::describe)
            .sorted()
            .collect(Collectors.joining("; "));
        return HttpResponse
            .<ErrorResponse>status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(fields.isEmpty() ? "Invalid request" : fields, INVALID_REQUEST));
    }

    // "build.req.task" → "task: must not be blank"
    static String describe(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        return path.substring(path.lastIndexOf('.') + 1) + ": " + violation.getMessage();
    }
}
