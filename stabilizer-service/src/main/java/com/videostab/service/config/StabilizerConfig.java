package com.videostab.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.videostab.core.model.TrimWindow;
import com.videostab.core.smoothing.SmoothingAlgorithm;
import com.videostab.service.store.TrajectoryStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StabilizerConfig {

    @Value("${stabilizer.storage.base-dir:./outputs}")
    private String storageBaseDir;

    @Value("${stabilizer.defaults.algorithm:kalman}")
    private String defaultAlgorithm;

    @Value("${stabilizer.defaults.cutoff:0.03}")
    private double defaultCutoff;

    @Value("${stabilizer.defaults.sigma:0.02}")
    private double defaultSigma;

    @Value("${stabilizer.defaults.delta:0.90}")
    private double defaultDelta;

    @Value("${stabilizer.defaults.kalman-r:20.0}")
    private double defaultKalmanR;

    @Value("${stabilizer.defaults.kalman-q:0.001}")
    private double defaultKalmanQ;

    @Value("${stabilizer.trim.start:0}")
    private int trimStart;

    @Value("${stabilizer.trim.end:0}")
    private int trimEnd;

    @Bean
    public SmoothingDefaults smoothingDefaults() {
        return new SmoothingDefaults(
            SmoothingAlgorithm.fromTag(defaultAlgorithm),
            defaultCutoff, defaultSigma, defaultDelta, defaultKalmanR, defaultKalmanQ,
            new TrimWindow(trimStart, trimEnd));
    }

    @Bean
    public TrajectoryStore trajectoryStore(ObjectMapper objectMapper) {
        return new TrajectoryStore(Path.of(storageBaseDir), objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
