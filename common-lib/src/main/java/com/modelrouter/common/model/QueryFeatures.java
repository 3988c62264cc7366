package com.modelrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Difficulty features derived from one prompt and its bounded recent context.
 * Produced by {@link com.modelrouter.common.feature.FeatureExtractor}; never persisted on its own.
 *
 * <p>{@code domainKeywords} is sorted so two extractions of the same input compare equal.
 */
public record QueryFeatures(
    @JsonProperty("estimatedTokens") int estimatedTokens,
    @JsonProperty("complexity") double complexity,
    @JsonProperty("hasCode") boolean hasCode,
    @JsonProperty("codeLineCount") int codeLineCount,
    @JsonProperty("domainKeywords") List<String> domainKeywords,
    @JsonProperty("toolUseNeeded") boolean toolUseNeeded,
    @JsonProperty("conversationDepth") int conversationDepth,
    @JsonProperty("ambiguity") double ambiguity
) {
    public QueryFeatures {
        domainKeywords = domainKeywords == null ? List.of() : List.copyOf(domainKeywords);
    }
}
