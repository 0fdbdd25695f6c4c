package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.videostab.core.model.FrameSize;
import com.videostab.core.model.TrimWindow;

/** Phase 3: compute the stabilization plan from the persisted raw and smooth trajectories. */
public record PlanRequest(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("frameSize") FrameSize frameSize,
    @JsonProperty("trim") TrimWindow trim
) {}
