package com.videostab.service.service;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.RelativeMotion;
import com.videostab.core.model.StabilizationPlan;
import com.videostab.core.model.Trajectory;
import com.videostab.core.pose.ComposedTrajectory;
import com.videostab.core.pose.PoseComposer;
import com.videostab.core.smoothing.Smoother;
import com.videostab.core.smoothing.SmootherFactory;
import com.videostab.core.smoothing.SmoothingAlgorithm;
import com.videostab.core.smoothing.SmoothingParams;
import com.videostab.core.stabilize.CorrectionStabilizer;
import com.videostab.core.trace.TraceContextUtil;
import com.videostab.service.config.SmoothingDefaults;
import com.videostab.service.dto.ComposeRequest;
import com.videostab.service.dto.MotionSample;
import com.videostab.service.dto.PlanRequest;
import com.videostab.service.dto.SmoothRequest;
import com.videostab.service.dto.SmoothResponse;
import com.videostab.service.dto.StabilizeRequest;
import com.videostab.service.dto.StabilizeResponse;
import com.videostab.service.logger.PipelineFlowLogger;
import com.videostab.service.store.RunManifest;
import com.videostab.service.store.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the three stabilization phases (compose → smooth → plan), either in memory for a single
 * request or against a persisted run whose arrays are exchanged with external tools.
 *
 * <p>Every phase is CPU-bound and runs on {@code boundedElastic}; the traceId travels in the
 * Reactor Context. A failure in any phase aborts the request with the phase's
 * {@link StabilizationException}.
 */
@Service
public class StabilizationService {

    private static final Logger log = LoggerFactory.getLogger(StabilizationService.class);

    private final SmoothingDefaults defaults;
    private final TrajectoryStore store;
    private final PipelineFlowLogger flowLogger;
    private final String serviceVersion;

    public StabilizationService(SmoothingDefaults defaults,
                                TrajectoryStore store,
                                PipelineFlowLogger flowLogger,
                                @Value("${spring.application.version:1.0.0}") String serviceVersion) {
        this.defaults       = defaults;
        this.store          = store;
        this.flowLogger     = flowLogger;
        this.serviceVersion = serviceVersion;
    }

    // ── In-memory pipeline ─────────────────────────────────────────────────

    public Mono<StabilizeResponse> stabilize(StabilizeRequest request) {
        String traceId = TraceContextUtil.resolve(request.traceId());
        Mono<StabilizeResponse> pipeline = Mono.defer(() -> {
            SmoothingAlgorithm algorithm = defaults.resolveAlgorithm(request.algorithm());
            SmoothingParams params = defaults.resolveParams(algorithm, request.options());
            Smoother smoother = SmootherFactory.create(params);
            log.debug("Stabilize request. algorithm={} params={} samples={}", algorithm.tag(), params,
                request.motions() != null ? request.motions().size() : 0);

            return Mono.just(request)
                .doOnEach(flowLogger.stage(PipelineFlowLogger.REQUEST_RECEIVED))
                .map(r -> PoseComposer.compose(toMotions(r.motions())))
                .doOnEach(flowLogger.stage(PipelineFlowLogger.TRAJECTORY_COMPOSED))
                .map(composed -> new SmoothedRun(composed,
                    smoother.smooth(composed.trajectory(), composed.motions())))
                .doOnEach(flowLogger.stage(PipelineFlowLogger.TRAJECTORY_SMOOTHED))
                .map(run -> {
                    StabilizationPlan plan = CorrectionStabilizer.stabilize(
                        run.composed().trajectory(), run.smooth(),
                        defaults.resolveTrim(request.trim()), request.frameSize());
                    flowLogger.logPlan(plan, algorithm.tag(), traceId);
                    return new StabilizeResponse(traceId, algorithm.tag(), run.composed().frameCount(),
                        run.composed().trajectory(), run.smooth(), plan);
                });
        })
        .subscribeOn(Schedulers.boundedElastic())
        .doOnError(e -> TraceContextUtil.withMdc(traceId, () ->
            log.warn("Stabilization failed. traceId={} error={}", traceId, e.getMessage())));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    // ── Phase 1: compose ───────────────────────────────────────────────────

    public Mono<RunManifest> composeRun(String runId, ComposeRequest request) {
        String traceId = TraceContextUtil.resolve(request.traceId());
        Mono<RunManifest> phase = Mono.fromCallable(() -> {
                ComposedTrajectory composed = PoseComposer.compose(toMotions(request.motions()));
                flowLogger.logWithTraceId(PipelineFlowLogger.TRAJECTORY_COMPOSED, traceId);

                return store.withRunLock(runId, () -> {
                    store.saveComposed(runId, composed.trajectory(), composed.motions());
                    Instant now = Instant.now();
                    RunManifest manifest = new RunManifest();
                    manifest.setRunId(runId);
                    manifest.setTraceId(traceId);
                    manifest.setServiceVersion(serviceVersion);
                    manifest.setCreatedAt(now);
                    manifest.setUpdatedAt(now);
                    manifest.setFrameCount(composed.frameCount());
                    store.writeManifest(manifest);
                    return manifest;
                });
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(PipelineFlowLogger.ARTIFACTS_PERSISTED));
        return TraceContextUtil.withTraceId(phase, traceId);
    }

    // ── Phase 2: smooth ────────────────────────────────────────────────────

    public Mono<SmoothResponse> smoothRun(String runId, SmoothRequest request) {
        String traceId = TraceContextUtil.resolve(request.traceId());
        Mono<SmoothResponse> phase = Mono.fromCallable(() -> {
                SmoothingAlgorithm algorithm = defaults.resolveAlgorithm(request.algorithm());
                SmoothingParams params = defaults.resolveParams(algorithm, request.options());
                Smoother smoother = SmootherFactory.create(params);
                Map<String, Double> parameters = parameterMap(params);

                return store.withRunLock(runId, () -> {
                    Trajectory raw = store.loadTrajectory(runId);
                    Trajectory smooth = smoother.smooth(raw, store.loadMotions(runId));
                    flowLogger.logWithTraceId(PipelineFlowLogger.TRAJECTORY_SMOOTHED, traceId);

                    store.saveSmooth(runId, algorithm, smooth);
                    RunManifest manifest = store.readManifest(runId);
                    manifest.getSmoothing().put(algorithm.tag(), parameters);
                    manifest.setLastAlgorithm(algorithm.tag());
                    manifest.setUpdatedAt(Instant.now());
                    store.writeManifest(manifest);
                    return new SmoothResponse(runId, algorithm.tag(), smoother.isCausal(), parameters, smooth);
                });
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(PipelineFlowLogger.ARTIFACTS_PERSISTED));
        return TraceContextUtil.withTraceId(phase, traceId);
    }

    // ── Phase 3: plan ──────────────────────────────────────────────────────

    public Mono<StabilizationPlan> planRun(String runId, PlanRequest request) {
        String traceId = TraceContextUtil.resolve(request.traceId());
        Mono<StabilizationPlan> phase = Mono.fromCallable(() -> store.withRunLock(runId, () -> {
                RunManifest manifest = store.readManifest(runId);
                SmoothingAlgorithm algorithm = resolvePlanAlgorithm(request.algorithm(), manifest);
                requireCurrentSmooth(runId, algorithm, manifest);

                StabilizationPlan plan = CorrectionStabilizer.stabilize(
                    store.loadTrajectory(runId), store.loadSmooth(runId, algorithm),
                    defaults.resolveTrim(request.trim()), request.frameSize());
                flowLogger.logPlan(plan, algorithm.tag(), traceId);

                manifest.setZoomFactor(plan.zoomPlan().zoomFactor());
                manifest.setExtremeCorrection(plan.zoomPlan().extremeCorrection());
                manifest.setAnalysisStart(plan.analysisStart());
                manifest.setAnalysisEnd(plan.analysisEnd());
                manifest.setUpdatedAt(Instant.now());
                store.writeManifest(manifest);
                return plan;
            }))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(PipelineFlowLogger.ARTIFACTS_PERSISTED));
        return TraceContextUtil.withTraceId(phase, traceId);
    }

    public Mono<RunManifest> manifest(String runId) {
        return Mono.fromCallable(() -> store.readManifest(runId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** Request algorithm if given, otherwise the run's last smoothed algorithm, otherwise the default. */
    private SmoothingAlgorithm resolvePlanAlgorithm(String requested, RunManifest manifest) {
        if (requested != null && !requested.isBlank()) {
            return defaults.resolveAlgorithm(requested);
        }
        return defaults.resolveAlgorithm(manifest.getLastAlgorithm());
    }

    /**
     * A smooth array is only valid for the composition it was computed from: its algorithm must
     * be recorded in the manifest written by the latest compose phase.
     */
    private void requireCurrentSmooth(String runId, SmoothingAlgorithm algorithm, RunManifest manifest) {
        if (!manifest.getSmoothing().containsKey(algorithm.tag()) || !store.hasSmooth(runId, algorithm)) {
            throw new StabilizationException(FailureKind.INPUT_NOT_FOUND, "plan",
                "run " + runId + " has no " + algorithm.tag() + " smoothing for its current trajectory");
        }
    }

    private record SmoothedRun(ComposedTrajectory composed, Trajectory smooth) {}

    static List<RelativeMotion> toMotions(List<MotionSample> samples) {
        if (samples == null) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, "compose",
                "motions are required");
        }
        if (samples.stream().anyMatch(Objects::isNull)) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, "compose",
                "motions must not contain null samples");
        }
        return samples.stream().map(MotionSample::toRelativeMotion).toList();
    }

    static Map<String, Double> parameterMap(SmoothingParams params) {
        Map<String, Double> map = new LinkedHashMap<>();
        if (params instanceof SmoothingParams.Cutoff c) {
            map.put("cutoff", c.cutoff());
        } else if (params instanceof SmoothingParams.Gaussian g) {
            map.put("sigma", g.sigma());
        } else if (params instanceof SmoothingParams.LeakyIntegrator l) {
            map.put("delta", l.delta());
        } else if (params instanceof SmoothingParams.Kalman k) {
            map.put("r", k.r());
            map.put("q", k.q());
        }
        return map;
    }
}
