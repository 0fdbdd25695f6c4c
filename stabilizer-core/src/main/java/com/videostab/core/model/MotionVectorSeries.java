package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered sequence of relative motions aligned with a {@link Trajectory}:
 * entry {@code n} is the motion from frame {@code n-1} to frame {@code n}, and entry 0 is the
 * zero placeholder for the initial frame.
 *
 * <p>Array form is {@code (n, 3)} rows of {@code [dx, dy, dtheta]}.
 */
public final class MotionVectorSeries {

    private final List<RelativeMotion> motions;

    private MotionVectorSeries(List<RelativeMotion> motions) {
        this.motions = motions;
    }

    public static MotionVectorSeries of(List<RelativeMotion> motions) {
        return new MotionVectorSeries(List.copyOf(motions));
    }

    /** Prepends the zero placeholder to a list of per-transition motions. */
    public static MotionVectorSeries fromTransitions(List<RelativeMotion> transitions) {
        List<RelativeMotion> all = new ArrayList<>(transitions.size() + 1);
        all.add(RelativeMotion.ZERO);
        all.addAll(transitions);
        return new MotionVectorSeries(Collections.unmodifiableList(all));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MotionVectorSeries ofRows(double[][] rows) {
        List<RelativeMotion> motions = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != Trajectory.AXES) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length
                    + " columns, expected " + Trajectory.AXES);
            }
            motions.add(new RelativeMotion(rows[i][0], rows[i][1], rows[i][2]));
        }
        return new MotionVectorSeries(Collections.unmodifiableList(motions));
    }

    public int size() {
        return motions.size();
    }

    public RelativeMotion get(int index) {
        return motions.get(index);
    }

    public List<RelativeMotion> motions() {
        return motions;
    }

    /** Axis 0 = dx, 1 = dy, 2 = dtheta. */
    public double[] axis(int axis) {
        double[] values = new double[motions.size()];
        for (int i = 0; i < values.length; i++) {
            RelativeMotion m = motions.get(i);
            values[i] = switch (axis) {
                case 0 -> m.dx();
                case 1 -> m.dy();
                case 2 -> m.dtheta();
                default -> throw new IllegalArgumentException("No axis " + axis);
            };
        }
        return values;
    }

    @JsonValue
    public double[][] toRows() {
        double[][] rows = new double[motions.size()][];
        for (int i = 0; i < rows.length; i++) {
            RelativeMotion m = motions.get(i);
            rows[i] = new double[] {m.dx(), m.dy(), m.dtheta()};
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof MotionVectorSeries other && motions.equals(other.motions);
    }

    @Override
    public int hashCode() {
        return motions.hashCode();
    }

    @Override
    public String toString() {
        return "MotionVectorSeries[size=" + size() + "]";
    }
}
