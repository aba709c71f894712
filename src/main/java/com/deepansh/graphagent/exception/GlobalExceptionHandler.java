package com.deepansh.graphagent.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Only two failures are visible to clients as distinct errors: every model backend
 * exhausted (503) and conversation state that could not be persisted (500).
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AllBackendsExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleBackendsExhausted(AllBackendsExhaustedException ex) {
        log.error("Model dispatch failed, backends tried: {}", ex.getAttemptedBackends());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody("BACKENDS_EXHAUSTED",
                        "The model service is temporarily unavailable. Please try again later."));
    }

    @ExceptionHandler(CheckpointWriteException.class)
    public ResponseEntity<Map<String, Object>> handleCheckpointWrite(CheckpointWriteException ex) {
        log.error("Checkpoint write failed [threadId={}]: {}", ex.getThreadId(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("STATE_NOT_PERSISTED",
                        "The conversation state could not be saved. The turn was aborted."));
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<Map<String, Object>> handleAgentException(AgentException ex) {
        log.error("Agent error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("AGENT_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(errorBody("INVALID_REQUEST", msg));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(String code, String message) {
        return Map.of(
                "error", message,
                "code", code,
                "timestamp", Instant.now().toString()
        );
    }
}
