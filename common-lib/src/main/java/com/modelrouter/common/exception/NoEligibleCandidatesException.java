package com.modelrouter.common.exception;

/**
 * The merged candidate pool is empty: every policy candidate is unhealthy, unregistered
 * or excluded. Surfaced to the caller as-is; the router never substitutes a default model.
 */
public class NoEligibleCandidatesException extends RoutingException {

    public NoEligibleCandidatesException(String message) {
        super(ErrorCode.NO_ELIGIBLE_CANDIDATES, message);
    }

    public NoEligibleCandidatesException(String message, Throwable cause) {
        super(ErrorCode.NO_ELIGIBLE_CANDIDATES, message, cause);
    }
}
