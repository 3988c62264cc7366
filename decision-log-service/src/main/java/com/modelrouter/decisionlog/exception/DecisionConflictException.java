package com.modelrouter.decisionlog.exception;

/** Duplicate decision id on append, or a second outcome for the same decision. */
public class DecisionConflictException extends RuntimeException {

    public DecisionConflictException(String message) {
        super(message);
    }
}
