/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * @param detectionCoverage entities per hundred words, two decimals
 */
public record Summary(
        @JsonProperty("total_entities") int totalEntities,
        @JsonProperty("high_confidence_entities") int highConfidenceEntities,
        @JsonProperty("entity_types") List<String> entityTypes,
        @JsonProperty("entities_by_type") Map<String, Integer> entitiesByType,
        @JsonProperty("risk_distribution") Map<String, Integer> riskDistribution,
        @JsonProperty("text_length") int textLength,
        @JsonProperty("detection_coverage") double detectionCoverage) {}
