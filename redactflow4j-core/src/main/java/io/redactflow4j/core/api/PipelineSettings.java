/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Pipeline-wide thresholds.
 *
 * @param confidenceThreshold merged candidates below this are dropped
 * @param mergeThreshold minimum overlap ratio (intersection / union) to fuse two candidates
 * @param detectorTimeout per-detector budget; a detector that exceeds it contributes nothing
 */
public record PipelineSettings(double confidenceThreshold, double mergeThreshold, Duration detectorTimeout) {

    public PipelineSettings {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold out of [0,1]: " + confidenceThreshold);
        }
        if (mergeThreshold <= 0.0 || mergeThreshold > 1.0) {
            throw new IllegalArgumentException("mergeThreshold out of (0,1]: " + mergeThreshold);
        }
        Objects.requireNonNull(detectorTimeout, "detectorTimeout");
        if (detectorTimeout.isNegative() || detectorTimeout.isZero()) {
            throw new IllegalArgumentException("detectorTimeout must be positive");
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(0.5, 0.7, Duration.ofSeconds(5));
    }
}
