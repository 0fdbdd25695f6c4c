package com.videostab.service.controller;

import com.videostab.service.dto.StabilizeRequest;
import com.videostab.service.service.StabilizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/stabilize")
public class StabilizationController {

    private static final Logger log = LoggerFactory.getLogger(StabilizationController.class);

    private final StabilizationService stabilizationService;

    public StabilizationController(StabilizationService stabilizationService) {
        this.stabilizationService = stabilizationService;
    }

    /** Runs compose → smooth → plan in memory and returns both trajectories with the plan. */
    @PostMapping
    public Mono<ResponseEntity<Object>> stabilize(@RequestBody StabilizeRequest request) {
        log.info("[StabilizerAPI] stabilize. algorithm={} samples={}", request.algorithm(),
            request.motions() != null ? request.motions().size() : null);
        return stabilizationService.stabilize(request)
            .map(response -> ResponseEntity.<Object>ok(response))
            .onErrorResume(e -> FailureResponses.toResponse(e, "stabilize"));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
