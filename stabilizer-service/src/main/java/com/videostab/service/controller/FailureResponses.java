package com.videostab.service.controller;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps pipeline failures to HTTP responses with a small JSON error body. */
final class FailureResponses {

    private static final Logger log = LoggerFactory.getLogger(FailureResponses.class);

    private FailureResponses() {}

    static int statusFor(FailureKind kind) {
        return switch (kind) {
            case INPUT_NOT_FOUND       -> 404;
            case LENGTH_MISMATCH,
                 TOO_SHORT             -> 422;
            case INVALID_PARAMETER     -> 400;
            case UNSUPPORTED_ALGORITHM -> 501;
            case CORRUPT_ARRAY         -> 500;
        };
    }

    static Mono<ResponseEntity<Object>> toResponse(Throwable e, String endpoint) {
        Map<String, Object> body = new LinkedHashMap<>();
        int status;
        if (e instanceof StabilizationException se) {
            status = statusFor(se.getKind());
            body.put("kind", se.getKind().name());
            body.put("stage", se.getStage());
        } else if (e instanceof IllegalArgumentException) {
            status = 400;
        } else {
            status = 500;
        }
        body.put("error", String.valueOf(e.getMessage()));
        if (status >= 500) {
            log.error("[StabilizerAPI] {} failed. status={}", endpoint, status, e);
        } else {
            log.warn("[StabilizerAPI] {} rejected. status={} error={}", endpoint, status, e.getMessage());
        }
        return Mono.just(ResponseEntity.status(status).<Object>body(body));
    }
}
