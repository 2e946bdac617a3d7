/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionReport(
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonProperty("entities") List<EntityView> entities,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("detectors_used") List<String> detectorsUsed,
        @JsonProperty("confidence_threshold") double confidenceThreshold,
        @JsonProperty("merge_threshold") double mergeThreshold,
        @JsonProperty("preprocessing") Map<String, String> preprocessing) {}
