package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything the warping collaborator needs for one emitted frame.
 * {@code correction} is applied first, then the run-wide zoom; {@code combined} is the two composed.
 */
public record FrameCorrection(
    @JsonProperty("frameIndex") int frameIndex,
    @JsonProperty("delta") CorrectionDelta delta,
    @JsonProperty("correction") AffineTransform correction,
    @JsonProperty("combined") AffineTransform combined
) {}
