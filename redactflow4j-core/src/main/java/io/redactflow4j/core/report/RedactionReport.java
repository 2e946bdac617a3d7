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
public record RedactionReport(
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonProperty("redacted_text") String redactedText,
        @JsonProperty("total_redactions") int totalRedactions,
        @JsonProperty("redaction_count") Map<String, Integer> redactionCount,
        @JsonProperty("entities") List<RedactedEntityView> entities,
        @JsonProperty("skipped_entities") List<EntityView> skipped,
        @JsonProperty("processing_time_ms") long processingTimeMs,
        @JsonProperty("timestamp") String timestamp) {}
