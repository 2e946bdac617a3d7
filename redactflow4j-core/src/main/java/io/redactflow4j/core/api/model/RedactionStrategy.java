/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RedactionStrategy {
    FULL_REMOVAL, // span -> ""
    FULL_MASK, // every char -> mask char
    PARTIAL_MASK, // type-aware, format-preserving
    TOKENIZATION, // reversible with a key, hashed without
    PSEUDONYMIZATION, // synthetic value of the same type
    GENERALIZATION, // category placeholder
    NONE; // audit / testing

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RedactionStrategy fromId(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("strategy id is blank");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
