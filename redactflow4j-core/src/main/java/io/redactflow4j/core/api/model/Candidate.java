/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A detector's claim that {@code [start,end)} of the text it saw holds personal data.
 *
 * <p>A candidate with non-empty {@link #provenance()} is a merged candidate: its span is the union of
 * the absorbed inputs and its source reads {@code base+other}. Only the aggregation engine builds those.
 *
 * @param bbox may be null
 */
public record Candidate(
        String id,
        EntityType type,
        String text,
        int start,
        int end,
        double confidence,
        String source,
        BoundingBox bbox,
        Map<String, String> attributes,
        List<Provenance> provenance) {

    public static final String CUSTOM_TYPE_ATTRIBUTE = "custom_type";

    public Candidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("invalid span [" + start + "," + end + ")");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
    }

    public static Candidate of(EntityType type, String text, int start, int end, double confidence, String source) {
        return new Candidate(
                UUID.randomUUID().toString(), type, text, start, end, confidence, source, null, Map.of(), List.of());
    }

    public int length() {
        return end - start;
    }

    public boolean isMerged() {
        return !provenance.isEmpty();
    }

    public Candidate withConfidence(double value) {
        return new Candidate(id, type, text, start, end, value, source, bbox, attributes, provenance);
    }

    public Candidate withSpan(int newStart, int newEnd, String newText) {
        return new Candidate(id, type, newText, newStart, newEnd, confidence, source, bbox, attributes, provenance);
    }

    public Candidate withBoundingBox(BoundingBox box) {
        return new Candidate(id, type, text, start, end, confidence, source, box, attributes, provenance);
    }

    public Candidate withAttribute(String key, String value) {
        Map<String, String> m = new HashMap<>(attributes);
        m.put(key, value);
        return new Candidate(id, type, text, start, end, confidence, source, bbox, m, provenance);
    }

    public Candidate withAttributes(Map<String, String> extra) {
        Map<String, String> m = new HashMap<>(attributes);
        m.putAll(extra);
        return new Candidate(id, type, text, start, end, confidence, source, bbox, m, provenance);
    }
}
