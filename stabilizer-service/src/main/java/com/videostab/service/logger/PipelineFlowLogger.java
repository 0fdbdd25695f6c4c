package com.videostab.service.logger;

import com.videostab.core.model.StabilizationPlan;
import com.videostab.core.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the stabilization lifecycle inside the reactive pipeline.
 *
 * <p>Logs each stage a request passes through without touching the data. All methods are pure
 * side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: request accepted by the API</li>
 *   <li>{@link #TRAJECTORY_COMPOSED}: motions integrated into the raw trajectory</li>
 *   <li>{@link #TRAJECTORY_SMOOTHED}: smoother produced the smooth trajectory</li>
 *   <li>{@link #PLAN_COMPUTED}: zoom plan and per-frame corrections assembled</li>
 *   <li>{@link #ARTIFACTS_PERSISTED}: arrays and manifest written for a stored run</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.TRAJECTORY_SMOOTHED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String TRAJECTORY_COMPOSED = "TRAJECTORY_COMPOSED";
    public static final String TRAJECTORY_SMOOTHED = "TRAJECTORY_SMOOTHED";
    public static final String PLAN_COMPUTED       = "PLAN_COMPUTED";
    public static final String ARTIFACTS_PERSISTED = "ARTIFACTS_PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage.
     *
     * <p>Reads traceId from the Reactor Context embedded in the {@link Signal}, never from MDC.
     * Only fires on {@code onNext} signals.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Logs a stage when the traceId is already at hand. */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** One-line summary of a finished plan: algorithm, emitted frames, zoom and the extreme flag. */
    public void logPlan(StabilizationPlan plan, String algorithm, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} algorithm={} frames={} window=[{},{}) zoom={} "
                     + "extremeCorrection={} traceId={}",
                     PLAN_COMPUTED, algorithm, plan.frameCount(),
                     plan.analysisStart(), plan.analysisEnd(),
                     String.format("%.4f", plan.zoomPlan().zoomFactor()),
                     plan.zoomPlan().extremeCorrection(), traceId)
        );
    }
}
