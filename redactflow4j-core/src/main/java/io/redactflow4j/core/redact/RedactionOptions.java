/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RedactionStrategy;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * How a redaction call rewrites entities. Immutable; {@code with*} methods return copies.
 *
 * @param strategies per-type overrides of {@code defaultStrategy}
 * @param tokenKey enables reversible tokens; null means hash tokens
 * @param customReplacements per-type literal replacement, wins over any strategy
 * @param pseudonymSeed fixed seed for reproducible pseudonyms; null means a secure random source
 */
public record RedactionOptions(
        RedactionStrategy defaultStrategy,
        Map<EntityType, RedactionStrategy> strategies,
        char maskChar,
        boolean preserveFormat,
        boolean preserveLength,
        TokenKey tokenKey,
        Map<EntityType, String> customReplacements,
        Long pseudonymSeed) {

    public static final char DEFAULT_MASK_CHAR = 'X';

    public RedactionOptions {
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        strategies = strategies == null || strategies.isEmpty() ? Map.of() : Map.copyOf(strategies);
        customReplacements =
                customReplacements == null || customReplacements.isEmpty() ? Map.of() : Map.copyOf(customReplacements);
    }

    public static RedactionOptions defaults() {
        return new RedactionOptions(
                RedactionStrategy.PARTIAL_MASK, Map.of(), DEFAULT_MASK_CHAR, true, true, null, Map.of(), null);
    }

    public RedactionStrategy strategyFor(EntityType type) {
        return strategies.getOrDefault(type, defaultStrategy);
    }

    public RedactionOptions withDefaultStrategy(RedactionStrategy value) {
        return new RedactionOptions(value, strategies, maskChar, preserveFormat, preserveLength, tokenKey,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withStrategy(EntityType type, RedactionStrategy value) {
        Map<EntityType, RedactionStrategy> m = new EnumMap<>(EntityType.class);
        m.putAll(strategies);
        m.put(type, value);
        return new RedactionOptions(defaultStrategy, m, maskChar, preserveFormat, preserveLength, tokenKey,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withMaskChar(char value) {
        return new RedactionOptions(defaultStrategy, strategies, value, preserveFormat, preserveLength, tokenKey,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withPreserveFormat(boolean value) {
        return new RedactionOptions(defaultStrategy, strategies, maskChar, value, preserveLength, tokenKey,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withPreserveLength(boolean value) {
        return new RedactionOptions(defaultStrategy, strategies, maskChar, preserveFormat, value, tokenKey,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withTokenKey(TokenKey value) {
        return new RedactionOptions(defaultStrategy, strategies, maskChar, preserveFormat, preserveLength, value,
                customReplacements, pseudonymSeed);
    }

    public RedactionOptions withCustomReplacement(EntityType type, String replacement) {
        Map<EntityType, String> m = new EnumMap<>(EntityType.class);
        m.putAll(customReplacements);
        m.put(type, Objects.requireNonNull(replacement, "replacement"));
        return new RedactionOptions(defaultStrategy, strategies, maskChar, preserveFormat, preserveLength, tokenKey,
                m, pseudonymSeed);
    }

    public RedactionOptions withPseudonymSeed(Long value) {
        return new RedactionOptions(defaultStrategy, strategies, maskChar, preserveFormat, preserveLength, tokenKey,
                customReplacements, value);
    }
}
