package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Causal motion-vector integrator: estimates the shake component of the motion with an
 * exponentially decaying accumulator and subtracts it from the raw trajectory.
 *
 * <pre>
 *   V_int[0] = V[0]                          X_smooth[0] = X[0]
 *   V_int[n] = delta·V_int[n−1] + V[n]       X_smooth[n] = X[n] − V_int[n]
 * </pre>
 *
 * <p>{@code delta} near 1 gives long memory and heavier smoothing with more lag;
 * {@code delta = 0} gives {@code X_smooth[n] = X[n] − V[n]}. Single forward pass,
 * one accumulator per axis.
 */
public final class LeakyIntegratorSmoother implements Smoother {

    private static final Logger log = LoggerFactory.getLogger(LeakyIntegratorSmoother.class);

    private static final String STAGE = "leaky-integrator";

    private final double delta;

    public LeakyIntegratorSmoother(double delta) {
        if (!(delta >= 0.0 && delta < 1.0)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "delta must be in [0, 1), got " + delta);
        }
        this.delta = delta;
    }

    public double delta() {
        return delta;
    }

    @Override
    public SmoothingAlgorithm algorithm() {
        return SmoothingAlgorithm.LEAKY_INTEGRATOR;
    }

    @Override
    public Trajectory smooth(Trajectory trajectory, MotionVectorSeries motions) {
        if (motions == null) {
            throw new StabilizationException(FailureKind.INPUT_NOT_FOUND, STAGE,
                "motion-vector series is required");
        }
        if (motions.size() != trajectory.size()) {
            throw new StabilizationException(FailureKind.LENGTH_MISMATCH, STAGE,
                "motion vectors (" + motions.size() + ") and trajectory ("
                    + trajectory.size() + ") are not synchronized");
        }
        log.debug("Leaky integrator smoothing. delta={} samples={}", delta, trajectory.size());

        double[][] axes = new double[Trajectory.AXES][];
        for (int axis = 0; axis < Trajectory.AXES; axis++) {
            axes[axis] = integrate(trajectory.axis(axis), motions.axis(axis), delta);
        }
        return Trajectory.ofAxes(axes[0], axes[1], axes[2]);
    }

    static double[] integrate(double[] positions, double[] vectors, double delta) {
        int n = positions.length;
        double[] smoothed = new double[n];
        if (n == 0) return smoothed;

        double integrated = vectors[0];
        smoothed[0] = positions[0];
        for (int i = 1; i < n; i++) {
            integrated = delta * integrated + vectors[i];
            smoothed[i] = positions[i] - integrated;
        }
        return smoothed;
    }
}
