/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one redaction call.
 *
 * @param entities rewritten entities, in processing order (descending start offset)
 * @param skipped entities left untouched because their span was invalid or overlapped a rewritten one
 */
public record RedactionResult(
        boolean success,
        String failureReason,
        String originalText,
        String redactedText,
        Map<EntityType, Integer> redactionCount,
        List<RedactedEntity> entities,
        List<DetectedEntity> skipped,
        Duration processingTime,
        Instant timestamp) {

    public RedactionResult {
        redactionCount = redactionCount == null || redactionCount.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(redactionCount));
        entities = entities == null ? List.of() : List.copyOf(entities);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static RedactionResult failure(String reason, String originalText) {
        return new RedactionResult(
                false, reason, originalText, "", Map.of(), List.of(), List.of(), Duration.ZERO, Instant.now());
    }

    public int totalRedactions() {
        return redactionCount.values().stream().mapToInt(Integer::intValue).sum();
    }
}
