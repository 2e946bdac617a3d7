/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of {@link DetectionStats}.
 *
 * @param confidenceDistribution counts per 10% band, keyed {@code 0%-9%} ... {@code 90%-100%}
 */
public record StatsSnapshot(
        @JsonProperty("total_detections") long totalDetections,
        @JsonProperty("detections_by_detector") Map<String, Long> byDetector,
        @JsonProperty("detections_by_type") Map<String, Long> byType,
        @JsonProperty("confidence_distribution") Map<String, Long> confidenceDistribution) {

    public StatsSnapshot {
        byDetector = Collections.unmodifiableMap(new LinkedHashMap<>(byDetector));
        byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
        confidenceDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(confidenceDistribution));
    }
}
