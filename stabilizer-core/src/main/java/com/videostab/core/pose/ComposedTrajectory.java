package com.videostab.core.pose;

import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;

/**
 * Raw trajectory together with the motion-vector series it was integrated from.
 * Both always have the same length ({@code transitions + 1}).
 */
public record ComposedTrajectory(Trajectory trajectory, MotionVectorSeries motions) {

    public int frameCount() {
        return trajectory.size() - 1;
    }
}
