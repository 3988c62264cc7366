package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked entry produced by the scoring engine.
 *
 * <ul>
 *   <li>{@code successProbability}: logistic success estimate in (0, 1)</li>
 *   <li>{@code weightedScore}     : success probability divided by the cost factor; ranking key</li>
 *   <li>{@code abilityMissing}    : true when the checkpoint had no ability vector for the model
 *       and the fixed penalty was applied</li>
 * </ul>
 */
public record ScoredCandidate(
    @JsonProperty("modelId") String modelId,
    @JsonProperty("executorId") String executorId,
    @JsonProperty("costPerMillionTokens") double costPerMillionTokens,
    @JsonProperty("policyRank") int policyRank,
    @JsonProperty("successProbability") double successProbability,
    @JsonProperty("weightedScore") double weightedScore,
    @JsonProperty("abilityMissing") boolean abilityMissing,
    @JsonProperty("explanation") String explanation
) {
    public ScoredCandidate withExplanation(String explanation) {
        return new ScoredCandidate(modelId, executorId, costPerMillionTokens, policyRank,
                                   successProbability, weightedScore, abilityMissing, explanation);
    }
}
