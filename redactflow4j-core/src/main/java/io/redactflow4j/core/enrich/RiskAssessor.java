/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.enrich;

import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RiskLevel;

/** Per-type base risk, lowered for less certain findings. */
public final class RiskAssessor {
    static final double CERTAIN = 0.9;
    static final double PROBABLE = 0.7;

    /**
     * @param confidence the confidence the finding arrived with, before any validation adjustment
     */
    public RiskLevel assess(EntityType type, double confidence) {
        RiskLevel base = type.baseRisk();
        if (confidence >= CERTAIN) return base;
        if (confidence >= PROBABLE) return base.downgrade(1);
        return base.downgrade(2);
    }
}
