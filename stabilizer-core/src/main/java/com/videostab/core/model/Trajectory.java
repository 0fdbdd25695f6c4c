package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered sequence of absolute poses, one per frame, stored column-wise as three axes.
 *
 * <p>The same type represents both the raw trajectory produced by pose composition and the smooth
 * trajectory produced by a smoother. Axis accessors return defensive copies, so downstream stages
 * can never mutate an upstream artifact.
 *
 * <p>JSON and array form is {@code (n, 3)} rows of {@code [x, y, theta]}.
 */
public final class Trajectory {

    public static final int AXES = 3;

    private final double[] x;
    private final double[] y;
    private final double[] theta;

    private Trajectory(double[] x, double[] y, double[] theta) {
        this.x = x;
        this.y = y;
        this.theta = theta;
    }

    public static Trajectory ofAxes(double[] x, double[] y, double[] theta) {
        if (x.length != y.length || x.length != theta.length) {
            throw new IllegalArgumentException("Axis lengths differ: x=" + x.length
                + " y=" + y.length + " theta=" + theta.length);
        }
        return new Trajectory(x.clone(), y.clone(), theta.clone());
    }

    public static Trajectory ofPoses(List<Pose> poses) {
        int n = poses.size();
        double[] x = new double[n];
        double[] y = new double[n];
        double[] theta = new double[n];
        for (int i = 0; i < n; i++) {
            Pose p = poses.get(i);
            x[i] = p.x();
            y[i] = p.y();
            theta[i] = p.theta();
        }
        return new Trajectory(x, y, theta);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Trajectory ofRows(double[][] rows) {
        int n = rows.length;
        double[] x = new double[n];
        double[] y = new double[n];
        double[] theta = new double[n];
        for (int i = 0; i < n; i++) {
            if (rows[i].length != AXES) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length
                    + " columns, expected " + AXES);
            }
            x[i] = rows[i][0];
            y[i] = rows[i][1];
            theta[i] = rows[i][2];
        }
        return new Trajectory(x, y, theta);
    }

    public int size() {
        return x.length;
    }

    public boolean isEmpty() {
        return x.length == 0;
    }

    public Pose get(int index) {
        return new Pose(x[index], y[index], theta[index]);
    }

    public double[] xs() {
        return x.clone();
    }

    public double[] ys() {
        return y.clone();
    }

    public double[] thetas() {
        return theta.clone();
    }

    /** Axis 0 = x, 1 = y, 2 = theta. */
    public double[] axis(int axis) {
        return switch (axis) {
            case 0 -> xs();
            case 1 -> ys();
            case 2 -> thetas();
            default -> throw new IllegalArgumentException("No axis " + axis);
        };
    }

    /** First {@code length} poses; returns {@code this} when already that short. */
    public Trajectory truncate(int length) {
        if (length >= size()) return this;
        return new Trajectory(
            Arrays.copyOf(x, length), Arrays.copyOf(y, length), Arrays.copyOf(theta, length));
    }

    public List<Pose> poses() {
        List<Pose> poses = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            poses.add(get(i));
        }
        return Collections.unmodifiableList(poses);
    }

    @JsonValue
    public double[][] toRows() {
        double[][] rows = new double[size()][];
        for (int i = 0; i < size(); i++) {
            rows[i] = new double[] {x[i], y[i], theta[i]};
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trajectory other)) return false;
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y)
            && Arrays.equals(theta, other.theta);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(x) + Arrays.hashCode(y)) + Arrays.hashCode(theta);
    }

    @Override
    public String toString() {
        return "Trajectory[size=" + size() + "]";
    }
}
