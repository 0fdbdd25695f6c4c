package com.videostab.core.smoothing;

import org.ejml.simple.SimpleMatrix;

/**
 * One-dimensional constant-velocity Kalman filter with state {@code [position, velocity]}.
 *
 * <pre>
 *   F = [[1, 1], [0, 1]]   (unit time step)     H = [1, 0]
 *   Q = q·I₂                                     R = [r]
 *   x₀ = [0, 0]                                  P₀ = I₂
 * </pre>
 *
 * <p>Large {@code r} distrusts measurements (heavier smoothing); large {@code q} distrusts the
 * constant-velocity model (output follows the measurements more closely). The covariance update
 * uses the Joseph form, which keeps {@code P} symmetric positive semi-definite under round-off.
 *
 * <p>Instances are independent and hold their own state; not thread-safe.
 */
public final class ConstantVelocityKalmanFilter {

    private static final SimpleMatrix F = new SimpleMatrix(new double[][] {
        {1.0, 1.0},
        {0.0, 1.0}
    });
    private static final SimpleMatrix H = new SimpleMatrix(new double[][] {
        {1.0, 0.0}
    });
    private static final SimpleMatrix I = SimpleMatrix.identity(2);

    private final SimpleMatrix processNoise;
    private final SimpleMatrix measurementNoise;

    private SimpleMatrix state = new SimpleMatrix(2, 1);
    private SimpleMatrix covariance = SimpleMatrix.identity(2);

    public ConstantVelocityKalmanFilter(double r, double q) {
        this.processNoise = SimpleMatrix.identity(2).scale(q);
        this.measurementNoise = new SimpleMatrix(new double[][] {{r}});
    }

    public void predict() {
        state = F.mult(state);
        covariance = F.mult(covariance).mult(F.transpose()).plus(processNoise);
    }

    /**
     * Corrects the predicted state with measurement {@code z}.
     * When the innovation variance is zero (r = 0 and a fully certain state) the prediction is kept.
     */
    public void update(double z) {
        double innovation = z - H.mult(state).get(0, 0);
        double innovationVariance = H.mult(covariance).mult(H.transpose()).get(0, 0)
            + measurementNoise.get(0, 0);
        if (innovationVariance == 0.0) {
            return;
        }
        SimpleMatrix gain = covariance.mult(H.transpose()).divide(innovationVariance);
        state = state.plus(gain.scale(innovation));

        SimpleMatrix iKh = I.minus(gain.mult(H));
        covariance = iKh.mult(covariance).mult(iKh.transpose())
            .plus(gain.mult(measurementNoise).mult(gain.transpose()));
    }

    /** Predict then update; returns the filtered position. */
    public double step(double z) {
        predict();
        update(z);
        return position();
    }

    public double position() {
        return state.get(0, 0);
    }

    public double velocity() {
        return state.get(1, 0);
    }

    public SimpleMatrix covariance() {
        return covariance.copy();
    }
}
