/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts a {@link Recognizer} to the {@link Detector} contract: long texts are fed in chunks, labels are
 * mapped onto {@link EntityType}s (unknown labels are dropped), scores are clamped and spans outside the
 * text are discarded.
 */
public final class RecognizerDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(RecognizerDetector.class);

    public static final String LABEL_ATTRIBUTE = "model_label";
    public static final int DEFAULT_MAX_CHUNK = 2000;

    private final String name;
    private final Recognizer recognizer;
    private final Map<String, EntityType> labels;
    private final int maxChunk;

    public RecognizerDetector(String name, Recognizer recognizer) {
        this(name, recognizer, defaultLabels(), DEFAULT_MAX_CHUNK);
    }

    public RecognizerDetector(String name, Recognizer recognizer, Map<String, EntityType> labels, int maxChunk) {
        this.name = Objects.requireNonNull(name, "name");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        Map<String, EntityType> m = new HashMap<>();
        labels.forEach((k, v) -> m.put(k.toUpperCase(Locale.ROOT), v));
        this.labels = Collections.unmodifiableMap(m);
        if (maxChunk < 16) throw new IllegalArgumentException("maxChunk must be >= 16");
        this.maxChunk = maxChunk;
    }

    /** Common NER label vocabularies (CoNLL, OntoNotes, Presidio-style). */
    public static Map<String, EntityType> defaultLabels() {
        Map<String, EntityType> m = new HashMap<>();
        m.put("PERSON", EntityType.PERSON);
        m.put("PER", EntityType.PERSON);
        m.put("ORGANIZATION", EntityType.ORGANIZATION);
        m.put("ORG", EntityType.ORGANIZATION);
        m.put("LOCATION", EntityType.LOCATION);
        m.put("LOC", EntityType.LOCATION);
        m.put("GPE", EntityType.LOCATION);
        m.put("DATE", EntityType.DATE);
        m.put("DATE_TIME", EntityType.DATE);
        m.put("EMAIL", EntityType.EMAIL);
        m.put("EMAIL_ADDRESS", EntityType.EMAIL);
        m.put("PHONE", EntityType.PHONE);
        m.put("PHONE_NUMBER", EntityType.PHONE);
        m.put("CREDIT_CARD", EntityType.CREDIT_CARD);
        m.put("IBAN_CODE", EntityType.IBAN);
        m.put("IP_ADDRESS", EntityType.IP_ADDRESS);
        m.put("URL", EntityType.URL);
        m.put("SSN", EntityType.SSN);
        m.put("US_SSN", EntityType.SSN);
        m.put("PASSPORT", EntityType.PASSPORT);
        m.put("US_PASSPORT", EntityType.PASSPORT);
        m.put("DRIVER_LICENSE", EntityType.DRIVERS_LICENSE);
        m.put("US_DRIVER_LICENSE", EntityType.DRIVERS_LICENSE);
        return m;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public Set<EntityType> supportedTypes() {
        if (labels.isEmpty()) return Set.of();
        return Collections.unmodifiableSet(EnumSet.copyOf(labels.values()));
    }

    @Override
    public List<Candidate> detect(String text, DetectionOptions options) {
        if (text == null || text.isEmpty()) return List.of();
        DetectionOptions opts = options == null ? DetectionOptions.defaults() : options;
        List<Candidate> out = new ArrayList<>();
        try {
            int offset = 0;
            while (offset < text.length()) {
                int end = chunkEnd(text, offset);
                collect(text, offset, text.substring(offset, end), opts, out);
                offset = end;
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.warn("Recognizer '{}' failed: {}", name, e.toString());
            return List.of();
        }
        return out;
    }

    private void collect(String text, int offset, String chunk, DetectionOptions opts, List<Candidate> out)
            throws Exception {
        List<Recognizer.Recognition> found = recognizer.recognize(chunk);
        if (found == null) return;
        for (Recognizer.Recognition r : found) {
            if (r == null || r.label() == null) continue;
            EntityType type = labels.get(stripBio(r.label()));
            if (type == null) {
                log.debug("Recognizer '{}' label '{}' has no entity type, dropped", name, r.label());
                continue;
            }
            if (!opts.wants(type)) continue;
            if (r.start() < 0 || r.end() > chunk.length() || r.start() >= r.end()) continue;
            if (Double.isNaN(r.score())) continue;
            int s = offset + r.start();
            int e = offset + r.end();
            double score = Math.max(0.0, Math.min(1.0, r.score()));
            out.add(Candidate.of(type, text.substring(s, e), s, e, score, name)
                    .withAttribute(LABEL_ATTRIBUTE, r.label()));
        }
    }

    /** Cuts at the last whitespace before the limit so words are not split across chunks. */
    private int chunkEnd(String text, int offset) {
        int hard = Math.min(text.length(), offset + maxChunk);
        if (hard == text.length()) return hard;
        for (int i = hard; i > offset + maxChunk / 2; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) return i;
        }
        return hard;
    }

    static String stripBio(String label) {
        String l = label.toUpperCase(Locale.ROOT);
        if (l.startsWith("B-") || l.startsWith("I-")) l = l.substring(2);
        return l;
    }
}
