package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Optional per-request overrides; {@code null} fields fall back to the configured defaults. */
public record SmoothingOptions(
    @JsonProperty("cutoff") Double cutoff,
    @JsonProperty("sigma") Double sigma,
    @JsonProperty("delta") Double delta,
    @JsonProperty("r") Double r,
    @JsonProperty("q") Double q
) {
    public static final SmoothingOptions NONE = new SmoothingOptions(null, null, null, null, null);
}
