package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Causal smoother running three independent {@link ConstantVelocityKalmanFilter}s, one per axis.
 * Each sample is predicted, then updated with the raw measurement; the filtered position is emitted.
 *
 * <p>Filters are created fresh for every {@link #smooth} call, so one smoother instance can be
 * reused across trajectories.
 */
public final class KalmanSmoother implements Smoother {

    private static final Logger log = LoggerFactory.getLogger(KalmanSmoother.class);

    private static final String STAGE = "kalman";

    private final double r;
    private final double q;

    public KalmanSmoother(double r, double q) {
        if (!(r >= 0.0) || Double.isInfinite(r)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "R must be a finite value >= 0, got " + r);
        }
        if (!(q >= 0.0) || Double.isInfinite(q)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "Q must be a finite value >= 0, got " + q);
        }
        this.r = r;
        this.q = q;
    }

    @Override
    public SmoothingAlgorithm algorithm() {
        return SmoothingAlgorithm.KALMAN;
    }

    @Override
    public Trajectory smooth(Trajectory trajectory, MotionVectorSeries motions) {
        log.debug("Kalman smoothing. R={} Q={} samples={}", r, q, trajectory.size());
        double[][] axes = new double[Trajectory.AXES][];
        for (int axis = 0; axis < Trajectory.AXES; axis++) {
            axes[axis] = filter(trajectory.axis(axis));
        }
        return Trajectory.ofAxes(axes[0], axes[1], axes[2]);
    }

    double[] filter(double[] measurements) {
        ConstantVelocityKalmanFilter kf = new ConstantVelocityKalmanFilter(r, q);
        double[] filtered = new double[measurements.length];
        for (int i = 0; i < measurements.length; i++) {
            filtered[i] = kf.step(measurements[i]);
        }
        return filtered;
    }
}
