/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.Range;

/**
 * A paragraph of the processed text.
 *
 * @param original best-effort range of the same paragraph in the original text
 */
public record TextSegment(String text, int start, int end, Range original, String kind) {
    public int length() {
        return end - start;
    }
}
