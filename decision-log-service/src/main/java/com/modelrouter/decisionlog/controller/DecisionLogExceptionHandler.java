package com.modelrouter.decisionlog.controller;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.decisionlog.exception.DecisionConflictException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class DecisionLogExceptionHandler {

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(ConfigException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("code", ex.getCode().name(), "message", ex.getMessage()));
    }

    @ExceptionHandler(DecisionConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(DecisionConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("code", "DECISION_CONFLICT", "message", ex.getMessage()));
    }

    /** Two appends of the same id racing past the existence check; the unique index rejects the loser. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleDuplicateKey(DataIntegrityViolationException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("code", "DECISION_CONFLICT", "message", "Decision already logged"));
    }
}
