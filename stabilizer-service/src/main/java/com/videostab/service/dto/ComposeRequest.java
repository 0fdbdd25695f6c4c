package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Phase 1: integrate motions into a persisted raw trajectory. */
public record ComposeRequest(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("motions") List<MotionSample> motions
) {}
