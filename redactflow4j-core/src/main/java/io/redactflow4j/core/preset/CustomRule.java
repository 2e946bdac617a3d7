/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import io.redactflow4j.core.api.model.EntityType;
import java.util.Objects;

/**
 * Declarative custom rule, as read from configuration.
 *
 * @param name optional rule id; generated when null
 * @param label {@code custom_type} label for {@link EntityType#CUSTOM} rules; may be null
 */
public record CustomRule(String name, String pattern, EntityType type, double confidence, String label) {
    public CustomRule {
        Objects.requireNonNull(pattern, "pattern");
        type = type == null ? EntityType.CUSTOM : type;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static CustomRule of(String pattern, EntityType type, double confidence) {
        return new CustomRule(null, pattern, type, confidence, null);
    }
}
