/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.DetectedEntity;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running detection counters, safe for concurrent use. A merged finding counts once in the total and
 * once for each detector that contributed to it.
 */
public final class DetectionStats {
    static final int BANDS = 10;

    private final LongAdder total = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> byDetector = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LongAdder> byType = new ConcurrentHashMap<>();
    private final AtomicLongArray bands = new AtomicLongArray(BANDS);

    public void record(List<DetectedEntity> entities) {
        for (DetectedEntity e : entities) {
            total.increment();
            for (String source : e.source().split("\\+")) {
                byDetector.computeIfAbsent(source, k -> new LongAdder()).increment();
            }
            byType.computeIfAbsent(e.type().id(), k -> new LongAdder()).increment();
            bands.incrementAndGet(band(e.confidence()));
        }
    }

    public StatsSnapshot snapshot() {
        Map<String, Long> detectors = new TreeMap<>();
        byDetector.forEach((k, v) -> detectors.put(k, v.sum()));
        Map<String, Long> types = new TreeMap<>();
        byType.forEach((k, v) -> types.put(k, v.sum()));
        Map<String, Long> histogram = new LinkedHashMap<>();
        for (int b = 0; b < BANDS; b++) histogram.put(bandLabel(b), bands.get(b));
        return new StatsSnapshot(total.sum(), detectors, types, histogram);
    }

    public void reset() {
        total.reset();
        byDetector.clear();
        byType.clear();
        for (int b = 0; b < BANDS; b++) bands.set(b, 0);
    }

    static int band(double confidence) {
        int b = (int) (confidence * BANDS);
        return Math.max(0, Math.min(BANDS - 1, b));
    }

    static String bandLabel(int band) {
        int low = band * 10;
        return band == BANDS - 1 ? low + "%-100%" : low + "%-" + (low + 9) + "%";
    }
}
