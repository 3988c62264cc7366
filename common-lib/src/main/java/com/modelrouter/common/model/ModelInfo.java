package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A model exposed by one executor.
 *
 * <p>Health and cost are owned by the executor's probe; the router only ever reads them
 * through a registry snapshot.
 */
public record ModelInfo(
    @JsonProperty("id") String id,
    @JsonProperty("executorId") String executorId,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("costPerMillionTokens") double costPerMillionTokens,
    @JsonProperty("contextWindow") int contextWindow,
    @JsonProperty("capabilityTags") List<String> capabilityTags,
    @JsonProperty("healthy") boolean healthy
) {
    public ModelInfo {
        capabilityTags = capabilityTags == null ? List.of() : List.copyOf(capabilityTags);
    }

    public ModelInfo withExecutor(String executorId) {
        return new ModelInfo(id, executorId, displayName, costPerMillionTokens,
                             contextWindow, capabilityTags, healthy);
    }

    public ModelInfo withHealthy(boolean healthy) {
        return new ModelInfo(id, executorId, displayName, costPerMillionTokens,
                             contextWindow, capabilityTags, healthy);
    }
}
