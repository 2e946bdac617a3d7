/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.List;
import java.util.Map;

/**
 * What the pipeline hands back for a detection request. Never thrown, always returned: on failure
 * {@link #success()} is false, {@link #failureReason()} explains why and every collection is empty.
 *
 * @param preprocessing normalization metadata (removed control chars, language, segment count, ...)
 * @param wordCount whitespace-separated words of the original text
 */
public record DetectionResult(
        boolean success,
        String failureReason,
        List<DetectedEntity> entities,
        Map<String, String> preprocessing,
        List<String> detectorsUsed,
        double confidenceThreshold,
        double mergeThreshold,
        int textLength,
        int wordCount) {

    public DetectionResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        preprocessing = preprocessing == null ? Map.of() : Map.copyOf(preprocessing);
        detectorsUsed = detectorsUsed == null ? List.of() : List.copyOf(detectorsUsed);
    }

    public static DetectionResult failure(String reason) {
        return new DetectionResult(false, reason, List.of(), Map.of(), List.of(), 0.0, 0.0, 0, 0);
    }
}
