package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Append-only log entry for one routing decision.
 *
 * <p>Every field except {@code outcome} is fixed when the record is built; the record is a
 * Java record so it is never observable half-populated. The outcome is back-filled once by
 * the decision-log service.
 */
public record DecisionRecord(
    @JsonProperty("decisionId") String decisionId,
    @JsonProperty("parentDecisionId") String parentDecisionId,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("prompt") String prompt,
    @JsonProperty("classification") Classification classification,
    @JsonProperty("features") QueryFeatures features,
    @JsonProperty("candidates") List<ScoredCandidate> candidates,
    @JsonProperty("excludedModelIds") Set<String> excludedModelIds,
    @JsonProperty("selectedModelId") String selectedModelId,
    @JsonProperty("receivedAt") Instant receivedAt,
    @JsonProperty("decidedAt") Instant decidedAt,
    @JsonProperty("outcome") DecisionOutcome outcome
) {
    public DecisionRecord {
        candidates       = candidates == null ? List.of() : List.copyOf(candidates);
        excludedModelIds = excludedModelIds == null ? Set.of() : Set.copyOf(excludedModelIds);
    }

    public static DecisionRecord of(RoutingDecision decision, String prompt, Instant receivedAt) {
        return new DecisionRecord(
            decision.decisionId(), decision.parentDecisionId(), decision.requestId(), prompt,
            decision.classification(), decision.features(), decision.candidates(),
            decision.excludedModelIds(), decision.selectedModel().modelId(),
            receivedAt, decision.decidedAt(), null);
    }
}
