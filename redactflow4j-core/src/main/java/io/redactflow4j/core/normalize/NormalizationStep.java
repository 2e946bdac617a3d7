/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/** Named, independently toggleable normalization steps. */
public enum NormalizationStep {
    REMOVE_CONTROL_CHARS,
    NORMALIZE_WHITESPACE,
    NORMALIZE_UNICODE,
    DETECT_LANGUAGE,
    SEGMENT_TEXT;

    private static final List<NormalizationStep> DEFAULTS = List.of(values());

    public static List<NormalizationStep> defaults() {
        return DEFAULTS;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NormalizationStep fromId(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
