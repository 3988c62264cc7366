package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Operator-managed mapping from (domain, action) to an ordered list of preferred model ids.
 *
 * <p>{@link #WILDCARD} in the action slot makes a domain-only policy; in both slots it makes
 * the global default. Candidate ids need not be live; liveness is enforced when the router
 * merges the list with the registry snapshot.
 */
public record Policy(
    @JsonProperty("domain") String domain,
    @JsonProperty("action") String action,
    @JsonProperty("candidateModelIds") List<String> candidateModelIds,
    @JsonProperty("priority") int priority
) {
    public static final String WILDCARD = "*";

    public Policy {
        candidateModelIds = candidateModelIds == null ? List.of() : List.copyOf(candidateModelIds);
    }
}
