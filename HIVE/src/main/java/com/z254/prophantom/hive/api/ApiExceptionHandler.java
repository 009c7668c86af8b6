package com.z254.prophantom.hive.api;

import com.z254.prophantom.hive.common.exception.AdmissionRejectedException;
import com.z254.prophantom.hive.common.exception.HiveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to HTTP responses. Callers see the error kind and a short message,
 * never internal causes.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(HiveException.class)
    public ResponseEntity<ErrorResponse> handleHiveException(HiveException e) {
        HttpStatus status = statusOf(e);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        Map<String, Object> details = null;

        if (e instanceof AdmissionRejectedException) {
            AdmissionRejectedException rejected = (AdmissionRejectedException) e;
            long seconds = Math.max(1, (rejected.getRetryAfter().toMillis() + 999) / 1000);
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
            details = Map.of("scope", rejected.getScope().name(), "retryAfterSeconds", seconds);
        }
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", e.getKind(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        return builder.body(body(e.getKind().name(), e.getCode(), e.getMessage(), details));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getFieldErrors().forEach(error -> fields.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.badRequest()
                .body(body("VALIDATION_FAILED", HttpStatus.BAD_REQUEST.value(), "Invalid request", fields));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e) {
        return ResponseEntity.badRequest()
                .body(body("BAD_REQUEST", HttpStatus.BAD_REQUEST.value(), e.getReason(), null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(body("BAD_REQUEST", HttpStatus.BAD_REQUEST.value(), e.getMessage(), null));
    }

    static HttpStatus statusOf(HiveException e) {
        return switch (e.getKind()) {
            case ADMISSION_REJECTED -> HttpStatus.TOO_MANY_REQUESTS;
            case SESSION_EXPIRED -> HttpStatus.GONE;
            case BACKEND_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case AGENT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_STATE, STORE_CONFLICT -> HttpStatus.CONFLICT;
            case UNKNOWN_AGENT, NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    private static ErrorResponse body(String error, int code, String message, Map<String, Object> details) {
        return ErrorResponse.builder()
                .error(error)
                .code(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
    }
}
