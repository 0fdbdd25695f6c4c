package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One frame-to-frame rigid motion estimate, expressed in the previous frame's local coordinates.
 *
 * <p>{@link #ZERO} stands in for a transition where upstream tracking was lost: composing it
 * leaves the pose unchanged.
 */
public record RelativeMotion(
    @JsonProperty("dx") double dx,
    @JsonProperty("dy") double dy,
    @JsonProperty("dtheta") double dtheta
) {
    public static final RelativeMotion ZERO = new RelativeMotion(0.0, 0.0, 0.0);

    public boolean isZero() {
        return dx == 0.0 && dy == 0.0 && dtheta == 0.0;
    }
}
