package com.videostab.core.stabilize;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.AffineTransform;
import com.videostab.core.model.CorrectionDelta;
import com.videostab.core.model.FrameCorrection;
import com.videostab.core.model.FrameSize;
import com.videostab.core.model.StabilizationPlan;
import com.videostab.core.model.Trajectory;
import com.videostab.core.model.TrimWindow;
import com.videostab.core.model.ZoomPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives per-frame correction transforms and a run-wide zoom from a raw and a smooth trajectory.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Synchronize both trajectories to {@code min(len(raw), len(smooth))}.</li>
 *   <li>Correction delta per frame: {@code smooth − raw} on each axis.</li>
 *   <li>Resolve the analysis window: {@code end} is clamped to the synchronized length; a window
 *       with {@code end ≤ start} disables trimming and covers the whole sequence. An empty
 *       window fails with {@link FailureKind#TOO_SHORT}.</li>
 *   <li>Borders: {@code ceil(max |dx_corr|)}, {@code ceil(max |dy_corr|)} over the window.
 *       Rotation does not contribute.</li>
 *   <li>{@code safety = min((w − 2·bx)/w, (h − 2·by)/h)}; {@code zoom = 1/safety}, or
 *       {@value #MAX_ZOOM} when {@code safety ≤ }{@value #MIN_SAFETY_SCALE}.</li>
 *   <li>Each emitted frame gets the rigid correction (rotate by {@code dtheta_corr}, then
 *       translate) followed by the zoom about the frame center.</li>
 * </ol>
 * Only frames inside the resolved window are emitted.
 *
 * <p>Pure static utility: no state, no I/O.
 */
public final class CorrectionStabilizer {

    private static final Logger log = LoggerFactory.getLogger(CorrectionStabilizer.class);

    private static final String STAGE = "stabilize";

    /** Upper bound for the zoom factor; used when the safety scale collapses. */
    public static final double MAX_ZOOM = 20.0;

    /** Safety scales at or below this value are treated as extreme corrections. */
    public static final double MIN_SAFETY_SCALE = 0.01;

    private CorrectionStabilizer() {}

    public static StabilizationPlan stabilize(Trajectory raw, Trajectory smooth,
                                              TrimWindow trim, FrameSize frameSize) {
        validateFrameSize(frameSize);
        TrimWindow requested = trim != null ? trim : TrimWindow.DISABLED;
        if (requested.start() < 0 || requested.end() < 0) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "trim bounds must be >= 0, got " + requested);
        }

        List<CorrectionDelta> deltas = correctionDeltas(raw, smooth);
        TrimWindow window = resolveWindow(requested, deltas.size());
        log.debug("Analysis window resolved. frames={} start={} end={}",
            deltas.size(), window.start(), window.end());

        ZoomPlan zoomPlan = planZoom(deltas, window, frameSize);
        AffineTransform zoom = AffineTransform.zoomAboutCenter(
            zoomPlan.zoomFactor(), frameSize.width(), frameSize.height());

        List<FrameCorrection> frames = new ArrayList<>(window.end() - window.start());
        for (int i = window.start(); i < window.end(); i++) {
            CorrectionDelta delta = deltas.get(i);
            AffineTransform correction = AffineTransform.rigid(
                delta.dxCorr(), delta.dyCorr(), delta.dthetaCorr());
            frames.add(new FrameCorrection(i, delta, correction, correction.then(zoom)));
        }

        boolean trimmed = window.start() != 0 || window.end() != deltas.size();
        return new StabilizationPlan(zoomPlan, zoom, window.start(), window.end(), trimmed, frames);
    }

    /** {@code smooth − raw} per frame over the common length of both trajectories. */
    public static List<CorrectionDelta> correctionDeltas(Trajectory raw, Trajectory smooth) {
        int length = Math.min(raw.size(), smooth.size());
        if (raw.size() != smooth.size()) {
            log.debug("Synchronizing trajectories. raw={} smooth={} common={}",
                raw.size(), smooth.size(), length);
        }
        List<CorrectionDelta> deltas = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            deltas.add(CorrectionDelta.between(raw.get(i), smooth.get(i)));
        }
        return deltas;
    }

    /**
     * Applies the trimming rules to a sequence of {@code length} frames.
     *
     * @throws StabilizationException {@link FailureKind#TOO_SHORT} when no frame remains
     */
    public static TrimWindow resolveWindow(TrimWindow requested, int length) {
        int start = requested.start();
        int end = Math.min(requested.end(), length);
        if (end <= start) {
            if (requested.isEnabled()) {
                log.warn("Trim window {} does not fit {} frames. Analyzing all frames.",
                    requested, length);
            }
            start = 0;
            end = length;
        }
        if (start >= end) {
            throw new StabilizationException(FailureKind.TOO_SHORT, STAGE,
                "sequence of " + length + " frames is too short for analysis");
        }
        return new TrimWindow(start, end);
    }

    /** Border sizes and zoom factor from the worst translational correction inside {@code window}. */
    public static ZoomPlan planZoom(List<CorrectionDelta> deltas, TrimWindow window, FrameSize frameSize) {
        double maxDx = 0.0;
        double maxDy = 0.0;
        for (int i = window.start(); i < window.end(); i++) {
            CorrectionDelta delta = deltas.get(i);
            maxDx = Math.max(maxDx, Math.abs(delta.dxCorr()));
            maxDy = Math.max(maxDy, Math.abs(delta.dyCorr()));
        }

        int borderX = (int) Math.ceil(maxDx);
        int borderY = (int) Math.ceil(maxDy);
        double width = frameSize.width();
        double height = frameSize.height();
        double scaleX = (width - 2.0 * borderX) / width;
        double scaleY = (height - 2.0 * borderY) / height;
        double safetyScale = Math.min(scaleX, scaleY);

        // ceil(NaN) casts to 0, so NaN corrections must be caught before the border sizes
        boolean extreme = Double.isNaN(maxDx) || Double.isNaN(maxDy) || !(safetyScale > MIN_SAFETY_SCALE);
        double zoomFactor;
        if (extreme) {
            log.warn("Corrections too large for frame. maxDx={} maxDy={} frame={}x{} zoom clamped to {}",
                maxDx, maxDy, frameSize.width(), frameSize.height(), MAX_ZOOM);
            zoomFactor = MAX_ZOOM;
        } else {
            zoomFactor = Math.max(1.0, Math.min(MAX_ZOOM, 1.0 / safetyScale));
        }
        log.debug("Zoom planned. maxDx={} maxDy={} borderX={} borderY={} safetyScale={} zoom={}",
            maxDx, maxDy, borderX, borderY, safetyScale, zoomFactor);
        return new ZoomPlan(borderX, borderY, safetyScale, zoomFactor, extreme);
    }

    private static void validateFrameSize(FrameSize frameSize) {
        if (frameSize == null || frameSize.width() <= 0 || frameSize.height() <= 0) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "frame size must be positive, got " + frameSize);
        }
    }
}
