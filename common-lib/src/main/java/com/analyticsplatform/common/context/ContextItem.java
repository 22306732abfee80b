package com.analyticsplatform.common.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ContextItem(
    @JsonProperty("tier") ContextTier tier,
    @JsonProperty("key") String key,
    @JsonProperty("text") String text
) {
    public static ContextItem of(ContextTier tier, String key, String text) {
        return new ContextItem(tier, key, text);
    }

    public int estimatedTokens() {
        return TokenEstimator.estimate(text);
    }
}
