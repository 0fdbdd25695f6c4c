package com.videostab.core.smoothing;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmootherFactoryTest {

    @Test
    @DisplayName("each parameter record dispatches to its smoother")
    void dispatch() {
        assertEquals(SmoothingAlgorithm.FREQUENCY_CUTOFF,
            SmootherFactory.create(new SmoothingParams.Cutoff(0.03)).algorithm());
        assertEquals(SmoothingAlgorithm.FREQUENCY_GAUSSIAN,
            SmootherFactory.create(new SmoothingParams.Gaussian(0.02)).algorithm());
        assertInstanceOf(LeakyIntegratorSmoother.class,
            SmootherFactory.create(new SmoothingParams.LeakyIntegrator(0.9)));
        assertInstanceOf(KalmanSmoother.class,
            SmootherFactory.create(new SmoothingParams.Kalman(20.0, 0.001)));
    }

    @Test
    @DisplayName("LEARNED → UNSUPPORTED_ALGORITHM")
    void learnedUnsupported() {
        StabilizationException e = assertThrows(StabilizationException.class,
            () -> SmootherFactory.create(new SmoothingParams.Learned()));
        assertEquals(FailureKind.UNSUPPORTED_ALGORITHM, e.getKind());
        assertEquals("smoothing", e.getStage());
    }

    @Test
    @DisplayName("out-of-domain parameters → INVALID_PARAMETER")
    void invalidParameters() {
        StabilizationException e = assertThrows(StabilizationException.class,
            () -> SmootherFactory.create(new SmoothingParams.LeakyIntegrator(1.5)));
        assertEquals(FailureKind.INVALID_PARAMETER, e.getKind());
        assertThrows(StabilizationException.class, () -> SmootherFactory.create(null));
    }

    @Test
    @DisplayName("algorithm tags round-trip and causal flags match the algorithm family")
    void tagsAndCausality() {
        for (SmoothingAlgorithm algorithm : SmoothingAlgorithm.values()) {
            assertEquals(algorithm, SmoothingAlgorithm.fromTag(algorithm.tag()));
            assertEquals(algorithm, SmoothingAlgorithm.fromTag(algorithm.name()));
        }
        assertEquals("frequency-cutoff", SmoothingAlgorithm.FREQUENCY_CUTOFF.tag());
        assertFalse(SmoothingAlgorithm.FREQUENCY_GAUSSIAN.isCausal());
        assertTrue(SmoothingAlgorithm.KALMAN.isCausal());
        assertThrows(IllegalArgumentException.class, () -> SmoothingAlgorithm.fromTag("median"));
    }
}
