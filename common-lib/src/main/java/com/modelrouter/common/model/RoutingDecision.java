package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * The router's answer to the gateway. The caller executes the backend call itself.
 *
 * <p>{@code candidates} is the full ranking computed for the original request, so that
 * {@code Router.select(decision, excluded)} can hand out the next-ranked model without
 * re-running classification or feature extraction. {@code excludedModelIds} accumulates
 * across re-selections.
 */
public record RoutingDecision(
    @JsonProperty("decisionId") String decisionId,
    @JsonProperty("parentDecisionId") String parentDecisionId,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("selectedModel") ScoredCandidate selectedModel,
    @JsonProperty("candidates") List<ScoredCandidate> candidates,
    @JsonProperty("classification") Classification classification,
    @JsonProperty("features") QueryFeatures features,
    @JsonProperty("excludedModelIds") Set<String> excludedModelIds,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("decidedAt") Instant decidedAt
) {
    public RoutingDecision {
        candidates       = candidates == null ? List.of() : List.copyOf(candidates);
        excludedModelIds = excludedModelIds == null ? Set.of() : Set.copyOf(excludedModelIds);
    }
}
