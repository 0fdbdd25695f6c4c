package com.videostab.core.smoothing;

import java.util.Locale;

/**
 * Closed set of smoothing algorithms a caller may select.
 *
 * <p>Adding an algorithm means adding a constant here, a parameter record implementing
 * {@link SmoothingParams}, and a case in {@link SmootherFactory#create(SmoothingParams)}.
 */
public enum SmoothingAlgorithm {

    /** Offline spectral low-pass with a hard cutoff. */
    FREQUENCY_CUTOFF(false),

    /** Offline spectral low-pass with a gaussian window. */
    FREQUENCY_GAUSSIAN(false),

    /** Causal exponential-decay motion integrator. */
    LEAKY_INTEGRATOR(true),

    /** Causal per-axis constant-velocity Kalman filter. */
    KALMAN(true),

    /** Reserved for a learned smoother; not implemented. */
    LEARNED(true);

    private final boolean causal;

    SmoothingAlgorithm(boolean causal) {
        this.causal = causal;
    }

    public boolean isCausal() {
        return causal;
    }

    /** File-name friendly tag, e.g. {@code frequency-cutoff}. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static SmoothingAlgorithm fromTag(String tag) {
        for (SmoothingAlgorithm algorithm : values()) {
            if (algorithm.tag().equalsIgnoreCase(tag) || algorithm.name().equalsIgnoreCase(tag)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown smoothing algorithm: " + tag);
    }
}
