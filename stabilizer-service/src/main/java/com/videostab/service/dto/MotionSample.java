package com.videostab.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.videostab.core.model.RelativeMotion;

/**
 * One frame transition as reported by the external motion estimator.
 * {@code trackingLost = true} means no estimate was possible; the sample is absorbed as a zero motion.
 */
public record MotionSample(
    @JsonProperty("dx") double dx,
    @JsonProperty("dy") double dy,
    @JsonProperty("dtheta") double dtheta,
    @JsonProperty("trackingLost") Boolean trackingLost
) {
    public RelativeMotion toRelativeMotion() {
        if (Boolean.TRUE.equals(trackingLost)) {
            return RelativeMotion.ZERO;
        }
        return new RelativeMotion(dx, dy, dtheta);
    }
}
