package com.clustermgmt.querytelemetry.controller;

import com.clustermgmt.querytelemetry.dto.ApiError;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine failures to {kind, message} JSON bodies.
 */
@RestControllerAdvice
@Slf4j
public class TelemetryExceptionHandler {

    @ExceptionHandler(TelemetryException.class)
    public ResponseEntity<ApiError> handleTelemetryException(TelemetryException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("[{}] {}", e.getKind(), e.getMessage());
        } else {
            log.debug("[{}] {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ApiError(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(new ApiError("INVALID_REQUEST", e.getMessage()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case SESSION_STATE_CONFLICT:
            case CONFLICTING_CANONICAL:
                return HttpStatus.CONFLICT;
            case INVALID_CLASSIFICATION:
                return HttpStatus.NOT_FOUND;
            case SOURCE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
