package com.salesdw.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a JSON error body.
 *
 * Layer runs catch their own per-table failures, so what arrives here is a query against the
 * audit tables failing, a bad request, or a programming error.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException e) {
        log.error("Database error: {}", e.getMostSpecificCause().getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMostSpecificCause().getMessage(), e);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled exception: {}", e.getClass().getSimpleName(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message != null ? message : e.getClass().getSimpleName());
        body.put("exceptionType", e.getClass().getName());
        return ResponseEntity.status(status).body(body);
    }
}
