/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.report.Reporter;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Counts detections per type and detector, and keeps a bounded ring of the latest findings.
 * The ring never holds the matched text.
 */
public final class MicrometerReporter implements Reporter {
    public static final String COUNTER = "redactflow4j_pii_detected_total";
    static final int MIN_CAPACITY = 10;

    /** What the ring remembers about one finding. */
    public record RecentFinding(String type, String source, double confidence, String riskLevel, Instant at) {}

    private final MeterRegistry registry;
    private final Deque<RecentFinding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(MIN_CAPACITY, capacity);
    }

    @Override
    public synchronized void report(List<DetectedEntity> entities) {
        if (entities == null || entities.isEmpty()) return;
        Instant now = Instant.now();
        for (DetectedEntity e : entities) {
            registry.counter(COUNTER, "type", e.type().id(), "detector", e.source()).increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(new RecentFinding(e.type().id(), e.source(), e.confidence(), e.riskLevel().id(), now));
        }
    }

    /** Returns an unmodifiable snapshot of the recent findings ring buffer. */
    public synchronized List<RecentFinding> recentFindings() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
