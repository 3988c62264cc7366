package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Domain/action label produced by the task classifier.
 *
 * <p>{@code fallback} is true when the classifier timed out or answered with garbage and the
 * router substituted its configured default. The flag travels into the decision record.
 */
public record Classification(
    @JsonProperty("domain") String domain,
    @JsonProperty("action") String action,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("fallback") boolean fallback
) {
    public static Classification of(String domain, String action, double confidence, String reasoning) {
        return new Classification(domain, action, confidence, reasoning, false);
    }

    public static Classification fallback(String domain, String action, String reason) {
        return new Classification(domain, action, 0.0, "Fallback classification: " + reason, true);
    }

    public String label() {
        return domain + "/" + action;
    }
}
