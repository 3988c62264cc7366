package com.modelrouter.router.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelrouter.common.model.RoutingDecision;

import java.util.Set;

/** Body of {@code POST /api/v1/route/reselect}: the decision being retried plus the ids the gateway rejected. */
public record ReselectRequest(
    @JsonProperty("previous") RoutingDecision previous,
    @JsonProperty("excludedModelIds") Set<String> excludedModelIds
) {}
