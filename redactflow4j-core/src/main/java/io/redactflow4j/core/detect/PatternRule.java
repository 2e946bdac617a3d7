/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.model.EntityType;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One regex rule of a {@link RegexDetector}.
 *
 * <p>If the pattern declares a named group {@code val} (e.g. {@code SSN:\s*(?<val>\d{3}-\d{2}-\d{4})}),
 * only that group becomes the candidate span; the keyword around it is context, not data.
 *
 * @param name rule id, recorded in the candidate attributes as {@code pattern_name}
 * @param accept extra gate applied to the matched value; rejects keep the detector silent for that match
 */
public record PatternRule(
        String name,
        Pattern pattern,
        EntityType type,
        double confidence,
        Predicate<String> accept,
        Map<String, String> attributes) {

    static final String VALUE_GROUP = "val";
    public static final String PATTERN_NAME_ATTRIBUTE = "pattern_name";

    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(type, "type");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        accept = accept == null ? v -> true : accept;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static PatternRule of(String name, String regex, EntityType type, double confidence) {
        return new PatternRule(name, Pattern.compile(regex), type, confidence, null, Map.of());
    }

    public static PatternRule of(String name, String regex, int flags, EntityType type, double confidence) {
        return new PatternRule(name, Pattern.compile(regex, flags), type, confidence, null, Map.of());
    }

    public PatternRule accepting(Predicate<String> predicate) {
        return new PatternRule(name, pattern, type, confidence, predicate, attributes);
    }

    public PatternRule withAttribute(String key, String value) {
        Map<String, String> m = new HashMap<>(attributes);
        m.put(key, value);
        return new PatternRule(name, pattern, type, confidence, accept, m);
    }

    /** Looks the group up in the pattern source; {@code Pattern} offers no named-group query on Java 17. */
    boolean hasValueGroup() {
        return pattern.pattern().contains("(?<" + VALUE_GROUP + ">");
    }
}
