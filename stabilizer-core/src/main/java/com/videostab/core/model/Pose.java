package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Absolute accumulated camera position and orientation for one frame.
 *
 * <p>{@link #ORIGIN} is the fixed pose of frame 0; every trajectory starts there.
 */
public record Pose(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y,
    @JsonProperty("theta") double theta
) {
    public static final Pose ORIGIN = new Pose(0.0, 0.0, 0.0);
}
