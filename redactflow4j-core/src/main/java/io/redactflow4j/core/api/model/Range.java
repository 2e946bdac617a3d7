/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Half-open character range {@code [start,end)}; {@link #UNMAPPABLE} when no range could be resolved. */
public record Range(int start, int end) {
    public static final Range UNMAPPABLE = new Range(-1, -1);

    public boolean isUnmappable() {
        return start < 0 || end < 0;
    }

    public int length() {
        return isUnmappable() ? 0 : end - start;
    }
}
