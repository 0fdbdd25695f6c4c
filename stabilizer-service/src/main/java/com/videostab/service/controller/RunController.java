package com.videostab.service.controller;

import com.videostab.service.dto.ComposeRequest;
import com.videostab.service.dto.PlanRequest;
import com.videostab.service.dto.SmoothRequest;
import com.videostab.service.service.StabilizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Phase-by-phase API over a persisted run. Each phase reads the previous phase's arrays from the
 * run directory, so external tools can read or replace them between calls.
 *
 * <p>Typical flow:
 * <ol>
 *   <li>POST /{runId}/trajectory: compose motions, writes {@code trajectory_X_act.npy} and {@code vectors_V_act.npy}</li>
 *   <li>POST /{runId}/smooth: writes {@code X_smooth_<algorithm>.npy}</li>
 *   <li>POST /{runId}/plan: zoom plan and per-frame corrections</li>
 *   <li>GET /{runId}: manifest</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final StabilizationService stabilizationService;

    public RunController(StabilizationService stabilizationService) {
        this.stabilizationService = stabilizationService;
    }

    @PostMapping("/{runId}/trajectory")
    public Mono<ResponseEntity<Object>> compose(@PathVariable String runId,
                                                @RequestBody ComposeRequest request) {
        log.info("[RunAPI] compose. runId={}", runId);
        return stabilizationService.composeRun(runId, request)
            .map(manifest -> ResponseEntity.<Object>ok(manifest))
            .onErrorResume(e -> FailureResponses.toResponse(e, "compose " + runId));
    }

    @PostMapping("/{runId}/smooth")
    public Mono<ResponseEntity<Object>> smooth(@PathVariable String runId,
                                               @RequestBody(required = false) SmoothRequest request) {
        SmoothRequest body = request != null ? request : new SmoothRequest(null, null, null);
        log.info("[RunAPI] smooth. runId={} algorithm={}", runId, body.algorithm());
        return stabilizationService.smoothRun(runId, body)
            .map(response -> ResponseEntity.<Object>ok(response))
            .onErrorResume(e -> FailureResponses.toResponse(e, "smooth " + runId));
    }

    @PostMapping("/{runId}/plan")
    public Mono<ResponseEntity<Object>> plan(@PathVariable String runId,
                                             @RequestBody PlanRequest request) {
        log.info("[RunAPI] plan. runId={} algorithm={}", runId, request.algorithm());
        return stabilizationService.planRun(runId, request)
            .map(plan -> ResponseEntity.<Object>ok(plan))
            .onErrorResume(e -> FailureResponses.toResponse(e, "plan " + runId));
    }

    @GetMapping("/{runId}")
    public Mono<ResponseEntity<Object>> manifest(@PathVariable String runId) {
        return stabilizationService.manifest(runId)
            .map(manifest -> ResponseEntity.<Object>ok(manifest))
            .onErrorResume(e -> FailureResponses.toResponse(e, "manifest " + runId));
    }
}
