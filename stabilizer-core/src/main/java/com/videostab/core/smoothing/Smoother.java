package com.videostab.core.smoothing;

import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;

/**
 * Strategy contract for turning a noisy camera trajectory into a smooth one.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>return a trajectory of exactly the input length</li>
 *   <li>process x, y and theta independently (no cross-axis coupling)</li>
 *   <li>never mutate their inputs; every call allocates a fresh output</li>
 * </ul>
 *
 * <p>Current implementations: {@link FrequencyDomainSmoother} (non-causal, needs the whole
 * sequence), {@link LeakyIntegratorSmoother} and {@link KalmanSmoother} (causal, single forward
 * pass). Use {@link SmootherFactory} to obtain one from a {@link SmoothingParams} record.
 */
public interface Smoother {

    /**
     * @param trajectory raw absolute trajectory
     * @param motions    motion-vector series aligned with {@code trajectory}; only the leaky
     *                   integrator reads it, others accept {@code null}
     * @return smoothed trajectory, same length as {@code trajectory}
     */
    Trajectory smooth(Trajectory trajectory, MotionVectorSeries motions);

    SmoothingAlgorithm algorithm();

    /** True when output frame {@code n} depends only on inputs up to {@code n}. */
    default boolean isCausal() {
        return algorithm().isCausal();
    }
}
