package com.videostab.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AffineTransformTest {

    private static void assertPoint(double x, double y, double[] actual) {
        assertEquals(x, actual[0], 1e-9);
        assertEquals(y, actual[1], 1e-9);
    }

    @Test
    @DisplayName("rigid: rotate about the origin, then translate")
    void rigid() {
        AffineTransform t = AffineTransform.rigid(10, -5, Math.PI / 2);
        assertPoint(10, -4, t.apply(1, 0));
        assertPoint(9, -5, t.apply(0, 1));
    }

    @Test
    @DisplayName("zoomAboutCenter: center fixed, corners pushed outward")
    void zoomAboutCenter() {
        AffineTransform zoom = AffineTransform.zoomAboutCenter(2.0, 640, 480);
        assertPoint(320, 240, zoom.apply(320, 240));
        assertPoint(-320, -240, zoom.apply(0, 0));
        assertPoint(960, 720, zoom.apply(640, 480));
    }

    @Test
    @DisplayName("then() applies the receiver first")
    void composition() {
        AffineTransform translate = AffineTransform.rigid(5, 0, 0);
        AffineTransform rotate = AffineTransform.rigid(0, 0, Math.PI / 2);

        // (1, 0) → (6, 0) → (0, 6)
        assertPoint(0, 6, translate.then(rotate).apply(1, 0));
        // (1, 0) → (0, 1) → (5, 1)
        assertPoint(5, 1, rotate.then(translate).apply(1, 0));
    }

    @Test
    @DisplayName("identity is neutral for then()")
    void identity() {
        AffineTransform t = AffineTransform.rigid(3, 4, 0.3);
        assertEquals(t, AffineTransform.IDENTITY.then(t));
        assertEquals(t, t.then(AffineTransform.IDENTITY));
    }

    @Test
    @DisplayName("serializes as a 2×3 row-major matrix")
    void matrixLayout() {
        double[][] m = new AffineTransform(1, 2, 3, 4, 5, 6).toMatrix();
        assertArrayEquals(new double[] {1, 2, 3}, m[0]);
        assertArrayEquals(new double[] {4, 5, 6}, m[1]);
    }
}
