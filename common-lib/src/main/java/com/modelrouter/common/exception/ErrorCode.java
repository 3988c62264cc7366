package com.modelrouter.common.exception;

/**
 * Routing error taxonomy. Only pool-level failures and caller cancellation reach the gateway;
 * the rest are absorbed into a degraded result by the component that raised them.
 */
public enum ErrorCode {
    CONFIG_ERROR,
    CLASSIFICATION_TIMEOUT,
    CLASSIFICATION_MALFORMED,
    POLICY_UNAVAILABLE,
    NO_ELIGIBLE_CANDIDATES,
    CANCELLED
}
