package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Inbound routing call from the gateway.
 *
 * <p>{@code deadlineMs} is optional; when present the whole pipeline is abandoned once it
 * elapses. {@code requestId} doubles as the trace id and is generated when absent.
 */
public record RouteRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("prompt") String prompt,
    @JsonProperty("context") List<ConversationTurn> context,
    @JsonProperty("excludedModelIds") Set<String> excludedModelIds,
    @JsonProperty("deadlineMs") Long deadlineMs
) {
    public RouteRequest {
        context          = context == null ? List.of() : List.copyOf(context);
        excludedModelIds = excludedModelIds == null ? Set.of() : Set.copyOf(excludedModelIds);
    }

    public static RouteRequest of(String prompt) {
        return new RouteRequest(null, prompt, List.of(), Set.of(), null);
    }
}
