package com.videostab.core.synthetic;

/**
 * One generated sample: the clean panning path and the same path with jitter and shocks added.
 */
public record SyntheticSeries(double[] clean, double[] noisy) {

    public int length() {
        return clean.length;
    }
}
