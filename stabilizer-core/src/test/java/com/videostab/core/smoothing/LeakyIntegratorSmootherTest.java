package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.RelativeMotion;
import com.videostab.core.model.Trajectory;
import com.videostab.core.pose.ComposedTrajectory;
import com.videostab.core.pose.PoseComposer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LeakyIntegratorSmootherTest {

    private static ComposedTrajectory shakyPan(int frames, long seed) {
        Random random = new Random(seed);
        List<RelativeMotion> motions = new ArrayList<>();
        for (int i = 0; i < frames; i++) {
            motions.add(new RelativeMotion(
                2.0 + random.nextGaussian(), random.nextGaussian(), random.nextGaussian() * 0.01));
        }
        return PoseComposer.compose(motions);
    }

    @Nested
    @DisplayName("integrate() — recurrence")
    class IntegrateTests {

        @Test
        @DisplayName("delta = 0 → X_smooth[n] = X[n] − V[n] for n ≥ 1, first sample kept")
        void zeroDelta_noMemory() {
            double[] x = {0.0, 3.0, 7.0, 8.0, 12.0};
            double[] v = {0.0, 3.0, 4.0, 1.0, 4.0};

            double[] smooth = LeakyIntegratorSmoother.integrate(x, v, 0.0);

            assertEquals(0.0, smooth[0]);
            for (int i = 1; i < x.length; i++) {
                assertEquals(x[i] - v[i], smooth[i], 0.0, "frame " + i);
            }
        }

        @Test
        @DisplayName("decaying accumulator: V_int[n] = delta·V_int[n−1] + V[n]")
        void hand_computed() {
            double[] x = {10.0, 11.0, 13.0};
            double[] v = {1.0, 2.0, 4.0};

            double[] smooth = LeakyIntegratorSmoother.integrate(x, v, 0.5);

            // V_int = [1, 2.5, 5.25]
            assertArrayEquals(new double[] {10.0, 8.5, 7.75}, smooth, 1e-12);
        }

        @Test
        @DisplayName("empty input → empty output")
        void empty() {
            assertEquals(0, LeakyIntegratorSmoother.integrate(new double[0], new double[0], 0.9).length);
        }
    }

    @Nested
    @DisplayName("smooth() — contract")
    class SmoothTests {

        @Test
        @DisplayName("output has the input length and is causal")
        void lengthPreserved() {
            ComposedTrajectory composed = shakyPan(60, 3);
            LeakyIntegratorSmoother smoother = new LeakyIntegratorSmoother(0.9);

            Trajectory smooth = smoother.smooth(composed.trajectory(), composed.motions());

            assertEquals(composed.trajectory().size(), smooth.size());
            assertTrue(smoother.isCausal());
            assertEquals(composed.trajectory().get(0), smooth.get(0));
        }

        @Test
        @DisplayName("prefix of the output depends only on the prefix of the input")
        void causal() {
            ComposedTrajectory full = shakyPan(50, 9);
            int prefix = 20;
            Trajectory prefixTrajectory = full.trajectory().truncate(prefix);
            MotionVectorSeries prefixMotions = MotionVectorSeries.of(full.motions().motions().subList(0, prefix));

            LeakyIntegratorSmoother smoother = new LeakyIntegratorSmoother(0.8);
            Trajectory fullSmooth = smoother.smooth(full.trajectory(), full.motions());
            Trajectory prefixSmooth = smoother.smooth(prefixTrajectory, prefixMotions);

            assertEquals(fullSmooth.truncate(prefix), prefixSmooth);
        }

        @Test
        @DisplayName("unequal trajectory and motion lengths → LENGTH_MISMATCH")
        void lengthMismatch() {
            ComposedTrajectory composed = shakyPan(10, 1);
            MotionVectorSeries shorter = MotionVectorSeries.of(composed.motions().motions().subList(0, 5));

            StabilizationException e = assertThrows(StabilizationException.class,
                () -> new LeakyIntegratorSmoother(0.9).smooth(composed.trajectory(), shorter));
            assertEquals(FailureKind.LENGTH_MISMATCH, e.getKind());
        }

        @Test
        @DisplayName("missing motion series → INPUT_NOT_FOUND")
        void missingMotions() {
            StabilizationException e = assertThrows(StabilizationException.class,
                () -> new LeakyIntegratorSmoother(0.9).smooth(shakyPan(5, 1).trajectory(), null));
            assertEquals(FailureKind.INPUT_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("delta outside [0, 1) → INVALID_PARAMETER")
        void invalidDelta() {
            assertThrows(StabilizationException.class, () -> new LeakyIntegratorSmoother(1.0));
            assertThrows(StabilizationException.class, () -> new LeakyIntegratorSmoother(-0.1));
            assertDoesNotThrow(() -> new LeakyIntegratorSmoother(0.0));
        }
    }
}
