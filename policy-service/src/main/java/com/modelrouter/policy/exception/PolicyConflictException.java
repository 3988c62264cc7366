package com.modelrouter.policy.exception;

public class PolicyConflictException extends RuntimeException {

    public PolicyConflictException(String domain, String action) {
        super("A policy for " + domain + "/" + action + " already exists");
    }
}
