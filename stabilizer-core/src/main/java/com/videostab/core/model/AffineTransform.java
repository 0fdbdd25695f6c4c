package com.videostab.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 2×3 affine matrix {@code [[a, b, tx], [c, d, ty]]}, the layout the frame-warping collaborator consumes.
 * Serialized to JSON as the nested row-major array.
 */
public record AffineTransform(double a, double b, double tx,
                              double c, double d, double ty) {

    public static final AffineTransform IDENTITY = new AffineTransform(1, 0, 0, 0, 1, 0);

    /** Rotation by {@code dtheta} about the origin followed by translation {@code (dx, dy)}. */
    public static AffineTransform rigid(double dx, double dy, double dtheta) {
        double cos = Math.cos(dtheta);
        double sin = Math.sin(dtheta);
        return new AffineTransform(cos, -sin, dx, sin, cos, dy);
    }

    /** Uniform scale by {@code zoom} that keeps the center of a {@code width × height} frame fixed. */
    public static AffineTransform zoomAboutCenter(double zoom, int width, int height) {
        return new AffineTransform(
            zoom, 0, (width - zoom * width) / 2.0,
            0, zoom, (height - zoom * height) / 2.0);
    }

    /** Returns the transform that applies {@code this} first and {@code next} second. */
    public AffineTransform then(AffineTransform next) {
        return new AffineTransform(
            next.a * a + next.b * c,
            next.a * b + next.b * d,
            next.a * tx + next.b * ty + next.tx,
            next.c * a + next.d * c,
            next.c * b + next.d * d,
            next.c * tx + next.d * ty + next.ty);
    }

    public double[] apply(double x, double y) {
        return new double[] {a * x + b * y + tx, c * x + d * y + ty};
    }

    @JsonValue
    public double[][] toMatrix() {
        return new double[][] {{a, b, tx}, {c, d, ty}};
    }
}
