package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@code GetCandidates(domain, action)}: the ordered candidate ids plus the
 * rule that matched. {@link PolicyMatchLevel#NONE} carries an empty list.
 */
public record PolicyMatch(
    @JsonProperty("domain") String domain,
    @JsonProperty("action") String action,
    @JsonProperty("matchLevel") PolicyMatchLevel matchLevel,
    @JsonProperty("candidateModelIds") List<String> candidateModelIds,
    @JsonProperty("priority") int priority
) {
    public PolicyMatch {
        candidateModelIds = candidateModelIds == null ? List.of() : List.copyOf(candidateModelIds);
    }

    public static PolicyMatch none(String domain, String action) {
        return new PolicyMatch(domain, action, PolicyMatchLevel.NONE, List.of(), 0);
    }

    public boolean isEmpty() {
        return candidateModelIds.isEmpty();
    }
}
