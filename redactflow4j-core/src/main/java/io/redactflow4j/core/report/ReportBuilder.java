/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.DetectionResult;
import io.redactflow4j.core.api.model.Provenance;
import io.redactflow4j.core.api.model.RedactedEntity;
import io.redactflow4j.core.api.model.RedactionDetail;
import io.redactflow4j.core.api.model.RedactionResult;
import io.redactflow4j.core.api.model.RiskLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Flattens pipeline results into the report records. Stateless. */
public final class ReportBuilder {
    public static final double HIGH_CONFIDENCE = 0.8;

    public DetectionReport detection(DetectionResult result) {
        if (!result.success()) {
            return new DetectionReport(false, result.failureReason(), List.of(), null, List.of(), 0.0, 0.0, Map.of());
        }
        List<EntityView> views = new ArrayList<>(result.entities().size());
        for (DetectedEntity e : result.entities()) views.add(view(e));
        return new DetectionReport(
                true,
                null,
                views,
                summary(result.entities(), result.textLength(), result.wordCount()),
                result.detectorsUsed(),
                result.confidenceThreshold(),
                result.mergeThreshold(),
                result.preprocessing());
    }

    public RedactionReport redaction(RedactionResult result) {
        if (!result.success()) {
            return new RedactionReport(
                    false, result.failureReason(), null, 0, Map.of(), List.of(), List.of(), 0L,
                    result.timestamp().toString());
        }
        Map<String, Integer> counts = new TreeMap<>();
        result.redactionCount().forEach((type, n) -> counts.put(type.id(), n));
        List<RedactedEntityView> done = new ArrayList<>(result.entities().size());
        for (RedactedEntity r : result.entities()) done.add(view(r));
        List<EntityView> skipped = new ArrayList<>(result.skipped().size());
        for (DetectedEntity e : result.skipped()) skipped.add(view(e));
        return new RedactionReport(
                true,
                null,
                result.redactedText(),
                result.totalRedactions(),
                counts,
                done,
                skipped,
                result.processingTime().toMillis(),
                result.timestamp().toString());
    }

    /**
     * @param wordCount words in the analysed text; coverage is entities per hundred words
     */
    public Summary summary(List<DetectedEntity> entities, int textLength, int wordCount) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byRisk = new LinkedHashMap<>();
        for (RiskLevel r : RiskLevel.values()) byRisk.put(r.id(), 0);
        int high = 0;
        for (DetectedEntity e : entities) {
            byType.merge(e.type().id(), 1, Integer::sum);
            byRisk.merge(e.riskLevel().id(), 1, Integer::sum);
            if (e.confidence() >= HIGH_CONFIDENCE) high++;
        }
        return new Summary(
                entities.size(),
                high,
                List.copyOf(byType.keySet()),
                byType,
                byRisk,
                textLength,
                coverage(entities.size(), wordCount));
    }

    static double coverage(int entities, int words) {
        double raw = (double) entities / Math.max(words, 1) * 100.0;
        return BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static EntityView view(DetectedEntity e) {
        Map<String, String> checks = new LinkedHashMap<>();
        e.validation().checks().forEach((k, v) -> checks.put(k, v.id()));
        List<String> mergedFrom = null;
        if (e.candidate().isMerged()) {
            mergedFrom = new ArrayList<>();
            for (Provenance p : e.candidate().provenance()) mergedFrom.add(p.candidateId());
        }
        return new EntityView(
                e.id(),
                e.type().id(),
                e.text(),
                e.start(),
                e.end(),
                e.confidence(),
                e.source(),
                e.riskLevel().id(),
                checks,
                e.context().full(),
                mergedFrom,
                e.candidate().bbox(),
                e.candidate().attributes().isEmpty() ? null : new TreeMap<>(e.candidate().attributes()));
    }

    static RedactedEntityView view(RedactedEntity r) {
        DetectedEntity e = r.entity();
        RedactionDetail d = r.detail();
        return new RedactedEntityView(
                e.id(),
                e.type().id(),
                e.start(),
                e.end(),
                e.confidence(),
                e.riskLevel().id(),
                r.redactedValue(),
                d.strategy().id(),
                d.method(),
                d.reversible(),
                d.maskChar() == null ? null : String.valueOf(d.maskChar()));
    }
}
