package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Real-world result of executing a routing decision, reported back by the gateway.
 * Attached to a decision record exactly once.
 */
public record DecisionOutcome(
    @JsonProperty("status") Status status,
    @JsonProperty("latencyMs") Long latencyMs,
    @JsonProperty("detail") String detail,
    @JsonProperty("recordedAt") Instant recordedAt
) {
    public enum Status {
        SUCCESS,
        FAILURE,
        TIMEOUT,
        REJECTED
    }
}
