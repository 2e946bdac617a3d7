/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Outcome of a single structural check. {@link #NOT_APPLICABLE} never moves confidence. */
public enum ValidationStatus {
    PASS,
    FAIL,
    NOT_APPLICABLE;

    public static ValidationStatus of(boolean passed) {
        return passed ? PASS : FAIL;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
