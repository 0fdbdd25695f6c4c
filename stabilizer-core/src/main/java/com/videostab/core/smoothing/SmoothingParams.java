package com.videostab.core.smoothing;

/**
 * Parameter set for exactly one {@link SmoothingAlgorithm}. One record per algorithm.
 */
public interface SmoothingParams {

    SmoothingAlgorithm algorithm();

    /** Frequency-domain hard cutoff; {@code cutoff} is a fraction of the sample count in [0, 0.5]. */
    record Cutoff(double cutoff) implements SmoothingParams {
        @Override
        public SmoothingAlgorithm algorithm() {
            return SmoothingAlgorithm.FREQUENCY_CUTOFF;
        }
    }

    /** Frequency-domain gaussian window; {@code sigma} in normalized frequency units, ≥ 0. */
    record Gaussian(double sigma) implements SmoothingParams {
        @Override
        public SmoothingAlgorithm algorithm() {
            return SmoothingAlgorithm.FREQUENCY_GAUSSIAN;
        }
    }

    /** Leaky integrator damping {@code delta} in [0, 1). */
    record LeakyIntegrator(double delta) implements SmoothingParams {
        @Override
        public SmoothingAlgorithm algorithm() {
            return SmoothingAlgorithm.LEAKY_INTEGRATOR;
        }
    }

    /** Kalman measurement noise {@code r} and process noise {@code q}, both ≥ 0. */
    record Kalman(double r, double q) implements SmoothingParams {
        @Override
        public SmoothingAlgorithm algorithm() {
            return SmoothingAlgorithm.KALMAN;
        }
    }

    record Learned() implements SmoothingParams {
        @Override
        public SmoothingAlgorithm algorithm() {
            return SmoothingAlgorithm.LEARNED;
        }
    }
}
