package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;

/**
 * Single dispatch point from a {@link SmoothingParams} record to its {@link Smoother}.
 */
public final class SmootherFactory {

    private SmootherFactory() {}

    public static Smoother create(SmoothingParams params) {
        if (params == null) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, "smoothing",
                "smoothing parameters are required");
        }
        return switch (params.algorithm()) {
            case FREQUENCY_CUTOFF   -> FrequencyDomainSmoother.cutoff(
                ((SmoothingParams.Cutoff) params).cutoff());
            case FREQUENCY_GAUSSIAN -> FrequencyDomainSmoother.gaussian(
                ((SmoothingParams.Gaussian) params).sigma());
            case LEAKY_INTEGRATOR   -> new LeakyIntegratorSmoother(
                ((SmoothingParams.LeakyIntegrator) params).delta());
            case KALMAN -> {
                SmoothingParams.Kalman kalman = (SmoothingParams.Kalman) params;
                yield new KalmanSmoother(kalman.r(), kalman.q());
            }
            case LEARNED -> throw new StabilizationException(FailureKind.UNSUPPORTED_ALGORITHM,
                "smoothing", "learned smoother is reserved and not implemented");
        };
    }
}
