/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.enrich;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Context;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.RiskLevel;
import io.redactflow4j.core.api.model.Validation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns candidates (offsets already in the original text) into {@link DetectedEntity}s: context window,
 * risk level, validation and the confidence adjustment that follows from it. Input order is kept.
 *
 * <h3>Adjustment</h3>
 * Each failed check multiplies the confidence: format 0.7, context 0.5, common word 0.6, length 0.8.
 * A finding that a pattern detector contributed to, arrived with at least 0.9 and did not fail the format
 * check gets ×1.1. The result is rounded to three decimals and clamped to [0,1].
 */
public final class EnrichmentStage {
    static final double FORMAT_PENALTY = 0.7;
    static final double CONTEXT_PENALTY = 0.5;
    static final double COMMON_WORD_PENALTY = 0.6;
    static final double LENGTH_PENALTY = 0.8;
    static final double PATTERN_BONUS = 1.1;
    static final double BONUS_FLOOR = 0.9;

    private final CandidateValidator validator;
    private final RiskAssessor risk;

    public EnrichmentStage() {
        this(new CandidateValidator(), new RiskAssessor());
    }

    public EnrichmentStage(CandidateValidator validator, RiskAssessor risk) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.risk = Objects.requireNonNull(risk, "risk");
    }

    /**
     * @param originalText the text the candidate offsets refer to
     * @param window characters of context on each side
     * @param patternSources names of pattern-kind detectors; decides the bonus
     */
    public List<DetectedEntity> enrich(
            String originalText, List<Candidate> candidates, int window, Set<String> patternSources) {
        List<DetectedEntity> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            out.add(enrich(originalText, c, window, patternSources));
        }
        return out;
    }

    public DetectedEntity enrich(String originalText, Candidate c, int window, Set<String> patternSources) {
        Context context = context(originalText, c.start(), c.end(), window);
        RiskLevel level = risk.assess(c.type(), c.confidence());
        Validation validation = validator.validate(c, context);
        double adjusted = adjust(c.confidence(), validation, fromPatternDetector(c.source(), patternSources));
        return new DetectedEntity(c.withConfidence(adjusted), level, validation, context);
    }

    static Context context(String text, int start, int end, int window) {
        int s = Math.max(0, Math.min(start, text.length()));
        int e = Math.max(s, Math.min(end, text.length()));
        String before = text.substring(Math.max(0, s - window), s);
        String after = text.substring(e, Math.min(text.length(), e + window));
        return new Context(before, text.substring(s, e), after);
    }

    static double adjust(double confidence, Validation v, boolean fromPattern) {
        double c = confidence;
        if (v.failed(Validation.FORMAT_VALID)) c *= FORMAT_PENALTY;
        if (v.failed(Validation.CONTEXT_APPROPRIATE)) c *= CONTEXT_PENALTY;
        if (v.failed(Validation.NOT_COMMON_WORD)) c *= COMMON_WORD_PENALTY;
        if (v.failed(Validation.LENGTH_APPROPRIATE)) c *= LENGTH_PENALTY;
        if (fromPattern && confidence >= BONUS_FLOOR && !v.failed(Validation.FORMAT_VALID)) {
            c = Math.min(1.0, c * PATTERN_BONUS);
        }
        double rounded = Math.round(c * 1000.0) / 1000.0;
        return Math.max(0.0, Math.min(1.0, rounded));
    }

    /** A merged source reads {@code a+b}; any pattern detector among the parts counts. */
    static boolean fromPatternDetector(String source, Set<String> patternSources) {
        if (patternSources == null || patternSources.isEmpty()) return false;
        for (String part : source.split("\\+")) {
            if (patternSources.contains(part)) return true;
        }
        return false;
    }
}
