package com.videostab.service.config;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.TrimWindow;
import com.videostab.core.smoothing.SmoothingAlgorithm;
import com.videostab.core.smoothing.SmoothingParams;
import com.videostab.service.dto.SmoothingOptions;

/**
 * Configured fallback values for every smoothing parameter, the default algorithm and the
 * default trim window. Request options override individual values.
 */
public record SmoothingDefaults(
    SmoothingAlgorithm algorithm,
    double cutoff,
    double sigma,
    double delta,
    double kalmanR,
    double kalmanQ,
    TrimWindow trim
) {

    public SmoothingAlgorithm resolveAlgorithm(String requested) {
        if (requested == null || requested.isBlank()) {
            return algorithm;
        }
        try {
            return SmoothingAlgorithm.fromTag(requested.trim());
        } catch (IllegalArgumentException e) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, "smoothing",
                e.getMessage(), e);
        }
    }

    public SmoothingParams resolveParams(SmoothingAlgorithm selected, SmoothingOptions options) {
        SmoothingOptions o = options != null ? options : SmoothingOptions.NONE;
        return switch (selected) {
            case FREQUENCY_CUTOFF   -> new SmoothingParams.Cutoff(orDefault(o.cutoff(), cutoff));
            case FREQUENCY_GAUSSIAN -> new SmoothingParams.Gaussian(orDefault(o.sigma(), sigma));
            case LEAKY_INTEGRATOR   -> new SmoothingParams.LeakyIntegrator(orDefault(o.delta(), delta));
            case KALMAN             -> new SmoothingParams.Kalman(
                orDefault(o.r(), kalmanR), orDefault(o.q(), kalmanQ));
            case LEARNED            -> new SmoothingParams.Learned();
        };
    }

    public TrimWindow resolveTrim(TrimWindow requested) {
        return requested != null ? requested : trim;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
