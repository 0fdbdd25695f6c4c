package com.videostab.core.smoothing;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Unnormalized forward / {@code 1/n}-normalized inverse DFT for sequences of any length.
 *
 * <p>Power-of-two lengths go straight to the commons-math radix-2 FFT. Any other length uses
 * Bluestein's chirp-z algorithm: the DFT is rewritten as a circular convolution with a chirp,
 * evaluated with radix-2 FFTs of length {@code m ≥ 2n − 1}. Cost is O(n log n) for every length.
 */
final class DiscreteFourierTransform {

    private static final FastFourierTransformer FFT =
        new FastFourierTransformer(DftNormalization.STANDARD);

    private DiscreteFourierTransform() {}

    static Complex[] forward(double[] signal) {
        Complex[] input = new Complex[signal.length];
        for (int i = 0; i < signal.length; i++) {
            input[i] = new Complex(signal[i], 0.0);
        }
        return forward(input);
    }

    static Complex[] forward(Complex[] input) {
        int n = input.length;
        if (n == 0) return new Complex[0];
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return FFT.transform(input.clone(), TransformType.FORWARD);
        }
        return bluestein(input);
    }

    /** Inverse DFT including the {@code 1/n} factor, via {@code conj(DFT(conj(X))) / n}. */
    static Complex[] inverse(Complex[] spectrum) {
        int n = spectrum.length;
        if (n == 0) return new Complex[0];
        Complex[] conjugated = new Complex[n];
        for (int i = 0; i < n; i++) {
            conjugated[i] = spectrum[i].conjugate();
        }
        Complex[] transformed = forward(conjugated);
        Complex[] result = new Complex[n];
        for (int i = 0; i < n; i++) {
            result[i] = transformed[i].conjugate().divide(n);
        }
        return result;
    }

    /** Real part of the inverse DFT; imaginary round-off residue is dropped. */
    static double[] inverseReal(Complex[] spectrum) {
        Complex[] values = inverse(spectrum);
        double[] real = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            real[i] = values[i].getReal();
        }
        return real;
    }

    private static Complex[] bluestein(Complex[] input) {
        int n = input.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) m <<= 1;

        // chirp[k] = exp(-i·π·k²/n); k² reduced mod 2n keeps the angle exact for long inputs
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int k = 0; k < n; k++) {
            long kk = ((long) k * k) % period;
            double angle = Math.PI * kk / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int i = 0; i < m; i++) {
            a[i] = Complex.ZERO;
            b[i] = Complex.ZERO;
        }
        for (int k = 0; k < n; k++) {
            a[k] = input[k].multiply(chirp[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            Complex c = chirp[k].conjugate();
            b[k] = c;
            b[m - k] = c;
        }

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        Complex[] fb = FFT.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        Complex[] convolution = FFT.transform(product, TransformType.INVERSE);

        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            result[k] = convolution[k].multiply(chirp[k]);
        }
        return result;
    }
}
