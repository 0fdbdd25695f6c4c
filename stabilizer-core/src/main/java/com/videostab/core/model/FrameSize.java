package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FrameSize(
    @JsonProperty("width") int width,
    @JsonProperty("height") int height
) {}
