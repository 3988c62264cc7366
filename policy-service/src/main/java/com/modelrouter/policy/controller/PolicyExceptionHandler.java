package com.modelrouter.policy.controller;

import com.modelrouter.common.exception.ConfigException;
import com.modelrouter.policy.exception.PolicyConflictException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class PolicyExceptionHandler {

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(ConfigException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("code", ex.getCode().name(), "message", ex.getMessage()));
    }

    @ExceptionHandler(PolicyConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(PolicyConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("code", "POLICY_EXISTS", "message", ex.getMessage()));
    }
}
