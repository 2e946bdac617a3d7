/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Ordered severity of a finding; declaration order is significant. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Moves {@code steps} levels down, never below {@link #LOW}. */
    public RiskLevel downgrade(int steps) {
        return values()[Math.max(0, ordinal() - Math.max(0, steps))];
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
