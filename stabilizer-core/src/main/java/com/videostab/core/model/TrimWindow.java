package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Half-open frame window {@code [start, end)} restricting both border analysis and frame emission.
 * Any window with {@code end <= start} (including {@link #DISABLED}) means "no trimming".
 */
public record TrimWindow(
    @JsonProperty("start") int start,
    @JsonProperty("end") int end
) {
    public static final TrimWindow DISABLED = new TrimWindow(0, 0);

    public boolean isEnabled() {
        return end > start;
    }
}
