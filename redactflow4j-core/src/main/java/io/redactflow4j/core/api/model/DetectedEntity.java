/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Objects;

/**
 * A candidate after enrichment. Offsets refer to the original (non-normalized) text.
 */
public record DetectedEntity(Candidate candidate, RiskLevel riskLevel, Validation validation, Context context) {
    public DetectedEntity {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(riskLevel, "riskLevel");
        Objects.requireNonNull(validation, "validation");
        Objects.requireNonNull(context, "context");
    }

    public String id() {
        return candidate.id();
    }

    public EntityType type() {
        return candidate.type();
    }

    public String text() {
        return candidate.text();
    }

    public int start() {
        return candidate.start();
    }

    public int end() {
        return candidate.end();
    }

    public double confidence() {
        return candidate.confidence();
    }

    public String source() {
        return candidate.source();
    }
}
