package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.videostab.core.model.FrameSize;
import com.videostab.core.model.TrimWindow;

import java.util.List;

/** Full in-memory pipeline request: motions in, stabilization plan out. */
public record StabilizeRequest(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("motions") List<MotionSample> motions,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("options") SmoothingOptions options,
    @JsonProperty("frameSize") FrameSize frameSize,
    @JsonProperty("trim") TrimWindow trim
) {}
