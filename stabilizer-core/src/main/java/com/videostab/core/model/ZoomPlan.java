package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Crop/zoom compensation computed once per stabilization run.
 *
 * <ul>
 *   <li>{@code borderX}, {@code borderY}: pixels exposed by the worst-case correction on each side</li>
 *   <li>{@code scaleFactor}: fraction of the frame that stays covered after correction</li>
 *   <li>{@code zoomFactor}: uniform scale-up hiding the borders, always in [1.0, 20.0]</li>
 *   <li>{@code extremeCorrection}: true when the safety scale collapsed and the zoom was clamped</li>
 * </ul>
 */
public record ZoomPlan(
    @JsonProperty("borderX") int borderX,
    @JsonProperty("borderY") int borderY,
    @JsonProperty("scaleFactor") double scaleFactor,
    @JsonProperty("zoomFactor") double zoomFactor,
    @JsonProperty("extremeCorrection") boolean extremeCorrection
) {}
