/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.EntityType;
import java.util.List;
import java.util.Objects;

/**
 * Knowledge base entry describing one kind of personal data: how it looks, which words tend to surround
 * it and how sensitive it is.
 *
 * @param name display name; unique per {@code type}
 * @param patterns regexes that match the data itself
 * @param contextKeywords words that raise confidence when found near a match
 * @param examples known values; an exact (case-insensitive) hit raises confidence
 */
public record EntityDefinition(
        EntityType type,
        String name,
        String description,
        List<String> patterns,
        List<String> contextKeywords,
        Sensitivity sensitivity,
        List<String> examples) {

    public enum Sensitivity {
        LOW(0.0),
        MEDIUM(0.1),
        HIGH(0.15),
        CRITICAL(0.2);

        private final double boost;

        Sensitivity(double boost) {
            this.boost = boost;
        }

        /** Added to the base confidence of a pattern match. */
        public double boost() {
            return boost;
        }
    }

    public EntityDefinition {
        Objects.requireNonNull(type, "type");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("definition name is blank");
        description = description == null ? "" : description;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        contextKeywords = contextKeywords == null ? List.of() : List.copyOf(contextKeywords);
        sensitivity = sensitivity == null ? Sensitivity.MEDIUM : sensitivity;
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public boolean sameKey(EntityDefinition other) {
        return type == other.type && name.equals(other.name);
    }
}
