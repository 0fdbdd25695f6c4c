package com.videostab.core.pose;

import com.videostab.core.model.Pose;
import com.videostab.core.model.RelativeMotion;
import com.videostab.core.model.Trajectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link PoseComposer}: dead-reckoning integration, tracking-loss
 * absorption and the aligned motion series.
 */
class PoseComposerTest {

    private static final double EPS = 1e-12;

    // ── next() — single step ──────────────────────────────────────────────

    @Nested
    @DisplayName("next() — single integration step")
    class NextTests {

        @Test
        @DisplayName("translation is rotated by the previous orientation")
        void translationUsesPreviousTheta() {
            Pose turned = new Pose(1.0, 2.0, Math.PI / 2);
            Pose next = PoseComposer.next(turned, new RelativeMotion(3.0, 0.0, 0.25));

            // dx along a 90° heading moves +y in the global frame
            assertEquals(1.0, next.x(), EPS);
            assertEquals(5.0, next.y(), EPS);
            assertEquals(Math.PI / 2 + 0.25, next.theta(), EPS);
        }

        @Test
        @DisplayName("ZERO motion leaves the pose unchanged")
        void zeroMotion_identity() {
            Pose pose = new Pose(4.0, -7.5, 0.3);
            assertEquals(pose, PoseComposer.next(pose, RelativeMotion.ZERO));
        }
    }

    // ── compose() — whole sequence ─────────────────────────────────────────

    @Nested
    @DisplayName("compose() — full sequence")
    class ComposeTests {

        @Test
        @DisplayName("empty motion list → single ORIGIN pose")
        void emptyMotions_singleOrigin() {
            ComposedTrajectory composed = PoseComposer.compose(Collections.emptyList());

            assertEquals(1, composed.trajectory().size());
            assertEquals(Pose.ORIGIN, composed.trajectory().get(0));
            assertEquals(1, composed.motions().size());
            assertTrue(composed.motions().get(0).isZero());
            assertEquals(0, composed.frameCount());
        }

        @Test
        @DisplayName("dtheta = 0 → poses are the cumulative sum of (dx, dy), theta stays 0")
        void noRotation_cumulativeSum() {
            Random random = new Random(42);
            List<RelativeMotion> motions = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                motions.add(new RelativeMotion(random.nextGaussian() * 3, random.nextGaussian() * 3, 0.0));
            }

            Trajectory trajectory = PoseComposer.compose(motions).trajectory();

            double sumX = 0.0;
            double sumY = 0.0;
            assertEquals(Pose.ORIGIN, trajectory.get(0));
            for (int i = 0; i < motions.size(); i++) {
                sumX += motions.get(i).dx();
                sumY += motions.get(i).dy();
                Pose pose = trajectory.get(i + 1);
                assertEquals(sumX, pose.x(), 1e-9, "x at frame " + (i + 1));
                assertEquals(sumY, pose.y(), 1e-9, "y at frame " + (i + 1));
                assertEquals(0.0, pose.theta(), 0.0);
            }
        }

        @Test
        @DisplayName("all-zero motions → constant ORIGIN trajectory")
        void allZero_constantOrigin() {
            List<RelativeMotion> motions = Collections.nCopies(25, RelativeMotion.ZERO);
            Trajectory trajectory = PoseComposer.compose(motions).trajectory();

            assertEquals(26, trajectory.size());
            trajectory.poses().forEach(p -> assertEquals(Pose.ORIGIN, p));
        }

        @Test
        @DisplayName("zero motion after a non-zero one keeps the pose across that frame boundary")
        void trackingLoss_absorbed() {
            List<RelativeMotion> motions = List.of(
                new RelativeMotion(2.0, 1.0, 0.1),
                new RelativeMotion(1.5, -0.5, 0.05),
                RelativeMotion.ZERO,
                new RelativeMotion(0.5, 0.5, 0.0));

            Trajectory trajectory = PoseComposer.compose(motions).trajectory();

            assertEquals(trajectory.get(2), trajectory.get(3));
            assertNotEquals(trajectory.get(3), trajectory.get(4));
        }

        @Test
        @DisplayName("trajectory and motion series have equal length, motion row 0 is the zero placeholder")
        void alignedLengths() {
            List<RelativeMotion> motions = List.of(
                new RelativeMotion(1, 0, 0), new RelativeMotion(0, 1, 0), new RelativeMotion(1, 1, 0.2));
            ComposedTrajectory composed = PoseComposer.compose(motions);

            assertEquals(composed.trajectory().size(), composed.motions().size());
            assertEquals(RelativeMotion.ZERO, composed.motions().get(0));
            assertEquals(motions, composed.motions().motions().subList(1, 4));
        }

        @Test
        @DisplayName("quarter turns then unit steps trace a closed square")
        void squarePath_returnsToOrigin() {
            List<RelativeMotion> motions = new ArrayList<>();
            motions.add(new RelativeMotion(0.0, 0.0, Math.PI / 2));
            for (int i = 0; i < 4; i++) {
                motions.add(new RelativeMotion(1.0, 0.0, Math.PI / 2));
            }

            Pose last = PoseComposer.compose(motions).trajectory().get(motions.size());
            assertEquals(0.0, last.x(), 1e-9);
            assertEquals(0.0, last.y(), 1e-9);
        }
    }

    // ── Accumulator — streaming form ───────────────────────────────────────

    @Nested
    @DisplayName("Accumulator — online composition")
    class AccumulatorTests {

        @Test
        @DisplayName("streaming result equals batch result")
        void streamingMatchesBatch() {
            List<RelativeMotion> motions = List.of(
                new RelativeMotion(1.0, 0.2, 0.01), new RelativeMotion(0.8, -0.1, -0.02),
                new RelativeMotion(1.2, 0.0, 0.03));

            PoseComposer.Accumulator accumulator = new PoseComposer.Accumulator();
            assertEquals(Pose.ORIGIN, accumulator.current());
            Pose last = null;
            for (RelativeMotion motion : motions) {
                last = accumulator.accept(motion);
            }

            assertEquals(3, accumulator.frameCount());
            assertEquals(last, accumulator.current());
            assertEquals(PoseComposer.compose(motions).trajectory(), accumulator.result().trajectory());
        }
    }
}
