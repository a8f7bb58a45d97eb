package com.myorg.hitl.review.web;

import com.myorg.hitl.contracts.core.exception.HitlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ReviewExceptionHandler {

    @ExceptionHandler(HitlException.class)
    public ResponseEntity<Map<String, Object>> handleHitl(HitlException ex) {
        HttpStatus status = switch (ex.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE, INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case STORE, CONNECTIVITY -> HttpStatus.SERVICE_UNAVAILABLE;
            case UPSTREAM_REJECTED, PARSE -> HttpStatus.BAD_GATEWAY;
            case UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.warn("Review action failed ({}): {}", ex.getReason(), ex.getMessage());
        }
        return body(status, ex.getReason(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String reason, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", reason);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
