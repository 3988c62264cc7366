package com.modelrouter.common.model;

/**
 * A live model admitted to one routing decision. {@code policyRank} is the model's position
 * in the matched policy's preferred list (0 = most preferred) and is the first tie-breaker
 * after the weighted score.
 */
public record Candidate(ModelInfo model, int policyRank) {

    public String modelId() {
        return model.id();
    }
}
