package com.videostab.core.pose;

import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Pose;
import com.videostab.core.model.RelativeMotion;
import com.videostab.core.model.Trajectory;

import java.util.ArrayList;
import java.util.List;

/**
 * Dead-reckoning integration of relative rigid motions into an absolute pose trajectory.
 *
 * <h3>Step</h3>
 * <pre>
 *   theta' = theta + dtheta
 *   x'     = x + dx·cos(theta) − dy·sin(theta)
 *   y'     = y + dx·sin(theta) + dy·cos(theta)
 * </pre>
 * The relative translation is rotated into the global frame with the <em>previous</em>
 * orientation. There is no drift correction: per-frame errors accumulate for the whole sequence.
 *
 * <p>Total over finite input. {@link RelativeMotion#ZERO} (tracking lost upstream) leaves the
 * pose unchanged for that step.
 *
 * <p>Pure static utility; {@link Accumulator} is the streaming form for online use.
 */
public final class PoseComposer {

    private PoseComposer() {}

    public static Pose next(Pose previous, RelativeMotion motion) {
        double cos = Math.cos(previous.theta());
        double sin = Math.sin(previous.theta());
        return new Pose(
            previous.x() + motion.dx() * cos - motion.dy() * sin,
            previous.y() + motion.dx() * sin + motion.dy() * cos,
            previous.theta() + motion.dtheta());
    }

    /**
     * Integrates per-transition motions starting from {@link Pose#ORIGIN}.
     *
     * @param transitions one motion per frame transition (frame {@code n-1} → {@code n})
     * @return trajectory of {@code transitions.size() + 1} poses with the aligned motion series
     */
    public static ComposedTrajectory compose(List<RelativeMotion> transitions) {
        Accumulator accumulator = new Accumulator();
        for (RelativeMotion motion : transitions) {
            accumulator.accept(motion);
        }
        return accumulator.result();
    }

    /**
     * Online pose composer: feed one motion per frame as it arrives, read the current pose at any time.
     * Not thread-safe; owned by a single producer.
     */
    public static final class Accumulator {

        private final List<Pose> poses = new ArrayList<>();
        private final List<RelativeMotion> transitions = new ArrayList<>();
        private Pose current = Pose.ORIGIN;

        public Accumulator() {
            poses.add(Pose.ORIGIN);
        }

        public Pose accept(RelativeMotion motion) {
            current = next(current, motion);
            poses.add(current);
            transitions.add(motion);
            return current;
        }

        public Pose current() {
            return current;
        }

        public int frameCount() {
            return transitions.size();
        }

        public ComposedTrajectory result() {
            return new ComposedTrajectory(
                Trajectory.ofPoses(poses),
                MotionVectorSeries.fromTransitions(transitions));
        }
    }
}
