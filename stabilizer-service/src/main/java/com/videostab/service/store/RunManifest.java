package com.videostab.service.store;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run bookkeeping written next to the run's arrays as {@code manifest.json}.
 *
 * smoothing: algorithm tag → parameters used for the persisted {@code X_smooth_<tag>.npy}
 * lastAlgorithm: tag of the most recent smoothing phase, used when a plan request names none
 */
@Data
@NoArgsConstructor
public class RunManifest {

    private String runId;

    private String traceId;

    /** {@code spring.application.version} of the service that composed the run. */
    private String serviceVersion;

    private Instant createdAt;

    private Instant updatedAt;

    /** Number of motion samples composed; arrays hold {@code frameCount + 1} rows. */
    private int frameCount;

    private Map<String, Map<String, Double>> smoothing = new LinkedHashMap<>();

    private String lastAlgorithm;

    private Double zoomFactor;

    private Boolean extremeCorrection;

    private Integer analysisStart;

    private Integer analysisEnd;
}
