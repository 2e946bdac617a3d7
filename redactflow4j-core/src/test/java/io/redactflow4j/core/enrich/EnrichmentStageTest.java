/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.enrich;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Context;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RiskLevel;
import io.redactflow4j.core.api.model.Validation;
import io.redactflow4j.core.api.model.ValidationStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class EnrichmentStageTest {

    private final EnrichmentStage stage = new EnrichmentStage();

    private static Candidate at(String text, String value, EntityType type, double conf, String source) {
        int start = text.indexOf(value);
        return Candidate.of(type, value, start, start + value.length(), conf, source);
    }

    private static Validation checks(ValidationStatus format, ValidationStatus context) {
        Map<String, ValidationStatus> m = new LinkedHashMap<>();
        m.put(Validation.FORMAT_VALID, format);
        m.put(Validation.CONTEXT_APPROPRIATE, context);
        return new Validation(m);
    }

    @Test
    public void validPatternHitGetsTheBonusCappedAtOne() {
        String text = "SSN 123-45-6789 on file";
        DetectedEntity e = stage.enrich(
                text, at(text, "123-45-6789", EntityType.SSN, 0.95, "rule_based"), 50, Set.of("rule_based"));

        assertEquals(1.0, e.confidence());
        assertEquals(RiskLevel.CRITICAL, e.riskLevel());
        assertEquals(ValidationStatus.PASS, e.validation().status(Validation.FORMAT_VALID));
    }

    @Test
    public void bonusNeedsAPatternSource() {
        String text = "SSN 123-45-6789 on file";
        DetectedEntity e = stage.enrich(
                text, at(text, "123-45-6789", EntityType.SSN, 0.95, "ner"), 50, Set.of("rule_based"));
        assertEquals(0.95, e.confidence());
    }

    @Test
    public void mergedSourceCountsIfAnyPartIsAPatternDetector() {
        assertTrue(EnrichmentStage.fromPatternDetector("ner+rule_based", Set.of("rule_based")));
        assertFalse(EnrichmentStage.fromPatternDetector("ner+person_name", Set.of("rule_based")));
    }

    @Test
    public void suspiciousContextHalvesConfidence() {
        String text = "This is a test number 555-123-4567";
        DetectedEntity e = stage.enrich(
                text, at(text, "555-123-4567", EntityType.PHONE, 0.8, "rule_based"), 50, Set.of("rule_based"));

        assertEquals(0.4, e.confidence());
        assertEquals(ValidationStatus.FAIL, e.validation().status(Validation.CONTEXT_APPROPRIATE));
        assertEquals(RiskLevel.MEDIUM, e.riskLevel());
    }

    @Test
    public void penaltiesMultiplyAndRoundToThreeDecimals() {
        assertEquals(0.315, EnrichmentStage.adjust(0.9, checks(ValidationStatus.FAIL, ValidationStatus.FAIL), true));
        assertEquals(0.7, EnrichmentStage.adjust(0.7, checks(ValidationStatus.NOT_APPLICABLE,
                ValidationStatus.NOT_APPLICABLE), true));
        assertEquals(0.99, EnrichmentStage.adjust(0.9, checks(ValidationStatus.PASS, ValidationStatus.PASS), true));
    }

    @Test
    public void contextWindowIsClippedAtTheTextEdges() {
        Context c = EnrichmentStage.context("abc SECRET xyz", 4, 10, 2);
        assertEquals("c ", c.before());
        assertEquals("SECRET", c.entity());
        assertEquals(" x", c.after());

        Context wide = EnrichmentStage.context("abc SECRET xyz", 4, 10, 50);
        assertEquals("abc ", wide.before());
        assertEquals(" xyz", wide.after());
    }

    @Test
    public void keepsInputOrder() {
        String text = "mail a@b.io or call 555-123-4567";
        List<Candidate> in = List.of(
                at(text, "555-123-4567", EntityType.PHONE, 0.85, "rule_based"),
                at(text, "a@b.io", EntityType.EMAIL, 0.95, "rule_based"));

        List<DetectedEntity> out = stage.enrich(text, in, 50, Set.of("rule_based"));

        assertEquals(EntityType.PHONE, out.get(0).type());
        assertEquals(EntityType.EMAIL, out.get(1).type());
    }

    @Test
    public void riskIsDowngradedForLessCertainFindings() {
        RiskAssessor risk = new RiskAssessor();
        assertEquals(RiskLevel.CRITICAL, risk.assess(EntityType.SSN, 0.9));
        assertEquals(RiskLevel.HIGH, risk.assess(EntityType.SSN, 0.75));
        assertEquals(RiskLevel.MEDIUM, risk.assess(EntityType.SSN, 0.5));
        assertEquals(RiskLevel.LOW, risk.assess(EntityType.URL, 0.1));
    }
}
