package com.switchboard.controller;

import com.switchboard.exception.ErrorKind;
import com.switchboard.exception.GatewayException;
import com.switchboard.exception.RequestValidationException;
import com.switchboard.service.StreamingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

/**
 * Maps the gateway failure taxonomy to HTTP statuses and OpenAI-style error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGatewayException(GatewayException e) {
        ErrorKind kind = e.getKind();
        if (kind.statusCode() >= 500) {
            log.error("Request failed with {}: {}", kind, e.getMessage());
        } else {
            log.warn("Request rejected with {}: {}", kind, e.getMessage());
        }
        return ResponseEntity.status(kind.statusCode())
                .body(Map.of("error", StreamingService.errorBody(e)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException e) {
        return handleGatewayException(new RequestValidationException(
                "Malformed request body: " + e.getReason(), e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error handling request", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", Map.of("type", "internal_error", "message", String.valueOf(e.getMessage()))));
    }
}
