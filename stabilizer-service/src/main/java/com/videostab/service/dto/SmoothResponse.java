package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.videostab.core.model.Trajectory;

import java.util.Map;

public record SmoothResponse(
    @JsonProperty("runId") String runId,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("causal") boolean causal,
    @JsonProperty("parameters") Map<String, Double> parameters,
    @JsonProperty("smoothTrajectory") Trajectory smoothTrajectory
) {}
