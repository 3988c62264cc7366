package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One prior message of the conversation, supplied as routing context. */
public record ConversationTurn(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content
) {}
