package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline spectral low-pass smoother. Non-causal: every output sample depends on the whole
 * sequence, so the full trajectory must be materialized first.
 *
 * <h3>Policies (applied per axis)</h3>
 * <pre>
 *   CUTOFF:   cut = floor(n·cutoff); zero bins [cut, n − cut); keep both spectrum ends
 *   GAUSSIAN: bin k *= exp(−f_k² / (2·sigma²)),  f_k = k/n for k ≤ (n−1)/2, else (k−n)/n
 * </pre>
 * Output is the real part of the inverse transform.
 *
 * <h3>Degenerate parameters</h3>
 * <ul>
 *   <li>{@code cut = 0}: the zeroing range is empty and the axis passes through unchanged.
 *       This reproduces the established behaviour of the cutoff filter; it is not "zero all".</li>
 *   <li>{@code sigma = 0}: identity passthrough (avoids dividing by zero).</li>
 *   <li>empty input: empty output.</li>
 * </ul>
 */
public final class FrequencyDomainSmoother implements Smoother {

    private static final Logger log = LoggerFactory.getLogger(FrequencyDomainSmoother.class);

    private static final String STAGE = "frequency-domain";

    private enum Policy { CUTOFF, GAUSSIAN }

    private final Policy policy;
    private final double parameter;

    private FrequencyDomainSmoother(Policy policy, double parameter) {
        this.policy = policy;
        this.parameter = parameter;
    }

    public static FrequencyDomainSmoother cutoff(double cutoff) {
        if (!(cutoff >= 0.0 && cutoff <= 0.5)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "cutoff must be in [0, 0.5], got " + cutoff);
        }
        return new FrequencyDomainSmoother(Policy.CUTOFF, cutoff);
    }

    public static FrequencyDomainSmoother gaussian(double sigma) {
        if (!(sigma >= 0.0) || Double.isInfinite(sigma)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "sigma must be a finite value >= 0, got " + sigma);
        }
        return new FrequencyDomainSmoother(Policy.GAUSSIAN, sigma);
    }

    @Override
    public SmoothingAlgorithm algorithm() {
        return policy == Policy.CUTOFF
            ? SmoothingAlgorithm.FREQUENCY_CUTOFF
            : SmoothingAlgorithm.FREQUENCY_GAUSSIAN;
    }

    @Override
    public Trajectory smooth(Trajectory trajectory, MotionVectorSeries motions) {
        log.debug("Frequency-domain smoothing. policy={} parameter={} samples={}",
            policy, parameter, trajectory.size());
        double[][] axes = new double[Trajectory.AXES][];
        for (int axis = 0; axis < Trajectory.AXES; axis++) {
            double[] samples = trajectory.axis(axis);
            axes[axis] = policy == Policy.CUTOFF
                ? filterCutoff(samples, parameter)
                : filterGaussian(samples, parameter);
        }
        return Trajectory.ofAxes(axes[0], axes[1], axes[2]);
    }

    // ── Per-axis filters ───────────────────────────────────────────────────

    static double[] filterCutoff(double[] signal, double cutoff) {
        int n = signal.length;
        int cut = (int) Math.floor(n * cutoff);
        if (cut == 0 || cut >= n - cut) {
            return signal.clone();
        }
        Complex[] spectrum = DiscreteFourierTransform.forward(signal);
        for (int k = cut; k < n - cut; k++) {
            spectrum[k] = Complex.ZERO;
        }
        return DiscreteFourierTransform.inverseReal(spectrum);
    }

    static double[] filterGaussian(double[] signal, double sigma) {
        int n = signal.length;
        if (n == 0) return new double[0];
        if (sigma == 0.0) return signal.clone();
        Complex[] spectrum = DiscreteFourierTransform.forward(signal);
        double twoSigmaSquared = 2.0 * sigma * sigma;
        for (int k = 0; k < n; k++) {
            double f = sampleFrequency(k, n);
            spectrum[k] = spectrum[k].multiply(Math.exp(-(f * f) / twoSigmaSquared));
        }
        return DiscreteFourierTransform.inverseReal(spectrum);
    }

    /** Normalized frequency of bin {@code k} for unit sample spacing. */
    static double sampleFrequency(int k, int n) {
        return k <= (n - 1) / 2 ? (double) k / n : (double) (k - n) / n;
    }
}
