package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Phase 2: smooth a persisted raw trajectory with the selected algorithm. */
public record SmoothRequest(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("options") SmoothingOptions options
) {}
