package com.incarts.analytics.api;

import com.incarts.analytics.domain.exception.AnalyticsQueryException;
import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.exception.BackendUnavailableException;
import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.exception.UnsupportedPlanException;
import com.incarts.analytics.domain.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps query failures to HTTP responses.
 *
 * 400 invalid filter or request parameter, 501 no executor can run the plan,
 * 503 no backend available, 504 backend timeout, 500 any other backend failure.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFilter(InvalidFilterException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.warn("Rejected request parameter: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(UnsupportedPlanException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedPlan(UnsupportedPlanException ex) {
        log.warn("No executor could run the query ({}): {}", ex.getExecutorKind(), ex.getMessage());
        return error(HttpStatus.NOT_IMPLEMENTED, ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(BackendUnavailableException ex) {
        log.error("No analytics backend available ({}): {}", ex.getExecutorKind(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Analytics backend unavailable");
    }

    @ExceptionHandler(BackendQueryException.class)
    public ResponseEntity<ErrorResponse> handleBackendFailure(BackendQueryException ex) {
        if (ex.isTimeout()) {
            log.error("{} backend timed out: {}", ex.getExecutorKind(), ex.getMessage());
            return error(HttpStatus.GATEWAY_TIMEOUT, "Analytics query timed out");
        }
        log.error("{} backend query failed: {}", ex.getExecutorKind(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Database query error: " + ex.getMessage());
    }

    @ExceptionHandler(AnalyticsQueryException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailure(AnalyticsQueryException ex) {
        log.error("Analytics query failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
