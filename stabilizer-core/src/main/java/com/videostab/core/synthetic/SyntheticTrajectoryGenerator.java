package com.videostab.core.synthetic;

import com.videostab.core.model.Trajectory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates paired clean/noisy camera-path series for evaluating smoothers, and as training data
 * for a future learned smoother.
 *
 * <h3>Model</h3>
 * <pre>
 *   t        = linspace(0, 10, length)
 *   clean(t) = a1·sin(2π·f1·t + p1) + a2·sin(2π·f2·t + p2)
 *              f ∈ [0.1, maxPanFrequency), a ∈ [0.5, 2.0), p ∈ [0, π)
 *   noisy    = clean + N(0, jitter²)
 *              + floor(length·shockProbability) steps, each of magnitude U(−shock, shock)
 *                added from a random index to the end (simulated tracking failures)
 * </pre>
 *
 * <p>Deterministic for a given {@link Random} seed.
 */
public final class SyntheticTrajectoryGenerator {

    public static final double DEFAULT_MAX_PAN_FREQUENCY = 0.5;
    public static final double DEFAULT_JITTER = 1.5;
    public static final double DEFAULT_SHOCK_PROBABILITY = 0.01;
    public static final double DEFAULT_SHOCK_STRENGTH = 8.0;

    private static final double DURATION = 10.0;

    private final Random random;
    private final double maxPanFrequency;
    private final double jitter;
    private final double shockProbability;
    private final double shockStrength;

    public SyntheticTrajectoryGenerator(long seed) {
        this(new Random(seed), DEFAULT_MAX_PAN_FREQUENCY, DEFAULT_JITTER,
            DEFAULT_SHOCK_PROBABILITY, DEFAULT_SHOCK_STRENGTH);
    }

    public SyntheticTrajectoryGenerator(Random random, double maxPanFrequency, double jitter,
                                        double shockProbability, double shockStrength) {
        this.random = random;
        this.maxPanFrequency = maxPanFrequency;
        this.jitter = jitter;
        this.shockProbability = shockProbability;
        this.shockStrength = shockStrength;
    }

    public SyntheticSeries next(int length) {
        double f1 = uniform(0.1, maxPanFrequency);
        double f2 = uniform(0.1, maxPanFrequency);
        double a1 = uniform(0.5, 2.0);
        double a2 = uniform(0.5, 2.0);
        double p1 = uniform(0.0, Math.PI);
        double p2 = uniform(0.0, Math.PI);

        double[] clean = new double[length];
        double[] noisy = new double[length];
        double step = length > 1 ? DURATION / (length - 1) : 0.0;
        for (int i = 0; i < length; i++) {
            double t = i * step;
            clean[i] = a1 * Math.sin(2 * Math.PI * f1 * t + p1)
                     + a2 * Math.sin(2 * Math.PI * f2 * t + p2);
            noisy[i] = clean[i] + random.nextGaussian() * jitter;
        }

        int shocks = (int) (length * shockProbability);
        for (int s = 0; s < shocks; s++) {
            int from = random.nextInt(length);
            double magnitude = uniform(-shockStrength, shockStrength);
            for (int i = from; i < length; i++) {
                noisy[i] += magnitude;
            }
        }
        return new SyntheticSeries(clean, noisy);
    }

    public List<SyntheticSeries> batch(int samples, int length) {
        List<SyntheticSeries> batch = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            batch.add(next(length));
        }
        return batch;
    }

    /** Three independent series as the x, y and theta axes of one trajectory pair. */
    public Trajectory[] nextTrajectoryPair(int length) {
        SyntheticSeries x = next(length);
        SyntheticSeries y = next(length);
        SyntheticSeries theta = next(length);
        return new Trajectory[] {
            Trajectory.ofAxes(x.clean(), y.clean(), theta.clean()),
            Trajectory.ofAxes(x.noisy(), y.noisy(), theta.noisy())
        };
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }
}
