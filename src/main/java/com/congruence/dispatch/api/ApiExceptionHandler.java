package com.congruence.dispatch.api;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.git.GitAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps typed pipeline failures to HTTP responses. Every body carries
 * {@code error_code} and {@code message}; git failures add {@code error_type} and {@code solution}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GitAccessException.class)
    public ResponseEntity<Map<String, Object>> handleGitAccess(GitAccessException ex) {
        Map<String, Object> body = body(ex);
        body.putAll(ex.toErrorBody());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(CongruenceException.class)
    public ResponseEntity<Map<String, Object>> handleCongruence(CongruenceException ex) {
        HttpStatus status = switch (ex.code()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case TRANSPORT, TOOL_EXECUTION -> HttpStatus.BAD_GATEWAY;
            case INGESTION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PERSISTENCE, WORKSPACE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("{} failure: {}", ex.code(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(body(ex));
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", "REJECTED");
        body.put("message", "Mining queue is full, try again later");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static Map<String, Object> body(CongruenceException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", ex.code().name());
        body.put("message", ex.getMessage());
        return body;
    }
}
