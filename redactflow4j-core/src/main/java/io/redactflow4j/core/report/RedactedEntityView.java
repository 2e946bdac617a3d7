/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One rewrite. The reversible payload is not part of this view; it stays in the in-memory result. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RedactedEntityView(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("start_char") int start,
        @JsonProperty("end_char") int end,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("redacted_value") String redactedValue,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("method") String method,
        @JsonProperty("reversible") Boolean reversible,
        @JsonProperty("mask_char") String maskChar) {}
