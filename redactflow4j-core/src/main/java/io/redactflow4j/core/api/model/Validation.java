/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named check results for one entity, in evaluation order.
 */
public record Validation(Map<String, ValidationStatus> checks) {
    public static final String FORMAT_VALID = "format_valid";
    public static final String CONTEXT_APPROPRIATE = "context_appropriate";
    public static final String NOT_COMMON_WORD = "not_common_word";
    public static final String LENGTH_APPROPRIATE = "length_appropriate";

    public Validation {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public ValidationStatus status(String check) {
        return checks.getOrDefault(check, ValidationStatus.NOT_APPLICABLE);
    }

    public boolean failed(String check) {
        return status(check) == ValidationStatus.FAIL;
    }
}
