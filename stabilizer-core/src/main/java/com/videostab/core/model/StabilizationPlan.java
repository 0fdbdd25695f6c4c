package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one stabilization run: the zoom plan, its frame-independent zoom matrix, the resolved
 * analysis window and the per-frame corrections for every emitted frame.
 */
public record StabilizationPlan(
    @JsonProperty("zoomPlan") ZoomPlan zoomPlan,
    @JsonProperty("zoomTransform") AffineTransform zoomTransform,
    @JsonProperty("analysisStart") int analysisStart,
    @JsonProperty("analysisEnd") int analysisEnd,
    @JsonProperty("trimmed") boolean trimmed,
    @JsonProperty("frames") List<FrameCorrection> frames
) {
    @JsonProperty("frameCount")
    public int frameCount() {
        return frames.size();
    }
}
