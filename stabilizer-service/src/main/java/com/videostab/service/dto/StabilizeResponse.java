package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.videostab.core.model.StabilizationPlan;
import com.videostab.core.model.Trajectory;

public record StabilizeResponse(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("frameCount") int frameCount,
    @JsonProperty("rawTrajectory") Trajectory rawTrajectory,
    @JsonProperty("smoothTrajectory") Trajectory smoothTrajectory,
    @JsonProperty("plan") StabilizationPlan plan
) {}
