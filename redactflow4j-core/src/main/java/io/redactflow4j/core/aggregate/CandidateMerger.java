/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.aggregate;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Provenance;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fuses overlapping candidates.
 *
 * <p>Candidates are walked by start offset; each one is compared with the already accepted ones and
 * folded into the first whose overlap ratio ({@code |a∩b| / |a∪b|}) reaches the threshold. The
 * higher-confidence input is the base (ties: longer span, then the lexicographically smaller source) and
 * keeps its type and matched text; the span becomes the union and the confidence the length-weighted
 * average of both.
 */
public final class CandidateMerger {
    static final String SOURCE_SEPARATOR = "+";

    /** Stable walk order; same input always merges the same way. */
    static final Comparator<Candidate> WALK_ORDER = Comparator.comparingInt(Candidate::start)
            .thenComparingInt(Candidate::end)
            .thenComparing(Candidate::source)
            .thenComparing(Comparator.comparingDouble(Candidate::confidence).reversed())
            .thenComparing(Candidate::id);

    private final double threshold;

    public CandidateMerger(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("merge threshold out of (0,1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /** Intersection over union of the two spans; 0 when disjoint. Symmetric by construction. */
    public static double overlapRatio(Candidate a, Candidate b) {
        int inter = Math.min(a.end(), b.end()) - Math.max(a.start(), b.start());
        if (inter <= 0) return 0.0;
        int union = Math.max(a.end(), b.end()) - Math.min(a.start(), b.start());
        return union == 0 ? 0.0 : (double) inter / union;
    }

    public List<Candidate> merge(List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(WALK_ORDER);
        List<Candidate> accepted = new ArrayList<>(sorted.size());
        for (Candidate c : sorted) {
            int hit = -1;
            for (int i = 0; i < accepted.size(); i++) {
                if (overlapRatio(accepted.get(i), c) >= threshold) {
                    hit = i;
                    break;
                }
            }
            if (hit < 0) {
                accepted.add(c);
            } else {
                accepted.set(hit, fuse(accepted.get(hit), c));
            }
        }
        return accepted;
    }

    /** Fuses two candidates regardless of their overlap. {@code fuse(a,b)} and {@code fuse(b,a)} agree. */
    public static Candidate fuse(Candidate a, Candidate b) {
        Candidate base = pickBase(a, b);
        Candidate other = base == a ? b : a;

        int start = Math.min(a.start(), b.start());
        int end = Math.max(a.end(), b.end());
        int weight = a.length() + b.length();
        double confidence = weight == 0
                ? Math.max(a.confidence(), b.confidence())
                : (a.confidence() * a.length() + b.confidence() * b.length()) / weight;
        confidence = Math.min(1.0, confidence);

        List<Provenance> provenance = new ArrayList<>();
        provenance.addAll(flatten(base));
        provenance.addAll(flatten(other));

        Map<String, String> attrs = new HashMap<>(other.attributes());
        attrs.putAll(base.attributes());

        return new Candidate(
                UUID.randomUUID().toString(),
                base.type(),
                base.text(),
                start,
                end,
                confidence,
                joinSources(base.source(), other.source()),
                base.bbox() != null ? base.bbox() : other.bbox(),
                attrs,
                provenance);
    }

    static Candidate pickBase(Candidate a, Candidate b) {
        int byConf = Double.compare(a.confidence(), b.confidence());
        if (byConf != 0) return byConf > 0 ? a : b;
        if (a.length() != b.length()) return a.length() > b.length() ? a : b;
        int bySource = a.source().compareTo(b.source());
        if (bySource != 0) return bySource < 0 ? a : b;
        // full tie: earlier span, then id, so the choice never depends on argument order
        if (a.start() != b.start()) return a.start() < b.start() ? a : b;
        return a.id().compareTo(b.id()) <= 0 ? a : b;
    }

    private static List<Provenance> flatten(Candidate c) {
        return c.isMerged() ? c.provenance() : List.of(new Provenance(c.id(), c.source(), c.confidence()));
    }

    /** {@code base+other}, with detectors already named on the left not repeated. */
    static String joinSources(String base, String other) {
        Set<String> parts = new LinkedHashSet<>(List.of(base.split("\\+")));
        parts.addAll(List.of(other.split("\\+")));
        return String.join(SOURCE_SEPARATOR, parts);
    }
}
