/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.Range;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Original text, current processed text and the map between them. Each normalization step returns a new
 * instance; the document lives for one detection run.
 */
public final class ProcessedDocument {
    private final String originalText;
    private final String processedText;
    private final PositionMap positionMap;
    private final List<TextSegment> segments;
    private final Map<String, String> metadata;

    private ProcessedDocument(
            String originalText,
            String processedText,
            PositionMap positionMap,
            List<TextSegment> segments,
            Map<String, String> metadata) {
        this.originalText = originalText;
        this.processedText = processedText;
        this.positionMap = positionMap;
        this.segments = List.copyOf(segments);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ProcessedDocument of(String text, Map<String, String> metadata) {
        Objects.requireNonNull(text, "text");
        return new ProcessedDocument(
                text, text, PositionMap.identity(text.length()), List.of(), metadata == null ? Map.of() : metadata);
    }

    /** Replaces the processed text; see {@link PositionMap#compose} for the index contract. */
    ProcessedDocument transform(String newText, int[] previousIndex, BitSet approximate) {
        if (previousIndex.length != newText.length()) {
            throw new IllegalStateException(
                    "index length " + previousIndex.length + " != text length " + newText.length());
        }
        return new ProcessedDocument(
                originalText, newText, positionMap.compose(previousIndex, approximate), segments, metadata);
    }

    ProcessedDocument withSegments(List<TextSegment> newSegments) {
        return new ProcessedDocument(originalText, processedText, positionMap, newSegments, metadata);
    }

    ProcessedDocument withMetadata(String key, String value) {
        Map<String, String> m = new LinkedHashMap<>(metadata);
        m.put(key, value);
        return new ProcessedDocument(originalText, processedText, positionMap, segments, m);
    }

    public String originalText() {
        return originalText;
    }

    public String processedText() {
        return processedText;
    }

    public PositionMap positionMap() {
        return positionMap;
    }

    public List<TextSegment> segments() {
        return segments;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Range mapRange(int processedStart, int processedEnd) {
        return positionMap.mapRange(processedStart, processedEnd);
    }

    public Range estimateRange(int processedStart, int processedEnd) {
        return positionMap.estimateRange(processedStart, processedEnd);
    }
}
