package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-frame difference between the smoothed and the raw pose ({@code smooth - raw}, per axis).
 * Applied to the frame as a counter-transform.
 */
public record CorrectionDelta(
    @JsonProperty("dxCorr") double dxCorr,
    @JsonProperty("dyCorr") double dyCorr,
    @JsonProperty("dthetaCorr") double dthetaCorr
) {
    public static CorrectionDelta between(Pose raw, Pose smooth) {
        return new CorrectionDelta(
            smooth.x() - raw.x(),
            smooth.y() - raw.y(),
            smooth.theta() - raw.theta());
    }
}
