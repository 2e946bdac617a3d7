/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.redactflow4j.core.api.model.BoundingBox;
import java.util.List;
import java.util.Map;

/** Flat view of one detected entity. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityView(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("text") String text,
        @JsonProperty("start_char") int start,
        @JsonProperty("end_char") int end,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("source") String source,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("validation") Map<String, String> validation,
        @JsonProperty("context") String context,
        @JsonProperty("merged_from") List<String> mergedFrom,
        @JsonProperty("bbox") BoundingBox bbox,
        @JsonProperty("metadata") Map<String, String> metadata) {}
