/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.model.DetectorType;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.detect.CustomRuleDetector;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DetectorRegistryTest {

    private final DetectorRegistry registry = new DetectorRegistry();

    private static List<String> names(List<Detector> detectors) {
        return detectors.stream().map(Detector::name).toList();
    }

    @Test
    public void defaultsAreBuiltInAFixedOrder() {
        assertEquals(
                List.of("rule_based", "credit_card", "iban", "ip", "financial", "healthcare", "person_name",
                        "custom_rules"),
                names(registry.defaults()));
    }

    @Test
    public void emptySelectionMeansEverything() {
        assertEquals(names(registry.defaults()), names(registry.build(List.of(), null)));
    }

    @Test
    public void onlySelectedTypesAreBuilt() {
        List<Detector> detectors = registry.build(EnumSet.of(DetectorType.PERSON_NAME, DetectorType.IBAN), List.of());
        assertEquals(List.of("iban", "person_name"), names(detectors));
    }

    @Test
    public void knowledgeBaseRunsOnlyWhenListed() {
        assertFalse(names(registry.defaults()).contains("knowledge_base"));

        List<Detector> detectors = registry.build(
                EnumSet.of(DetectorType.PERSON_NAME, DetectorType.KNOWLEDGE_BASE, DetectorType.CUSTOM_RULES), null);
        assertEquals(List.of("person_name", "knowledge_base", "custom_rules"), names(detectors));
    }

    @Test
    public void customRulesBringTheirDetectorAlong() {
        List<Detector> detectors = registry.build(
                EnumSet.of(DetectorType.RULE_BASED),
                List.of(new CustomRule("badge", "EMP-\\d{6}", EntityType.CUSTOM, 0.9, "employee_id")));

        assertEquals(List.of("rule_based", "custom_rules"), names(detectors));
        CustomRuleDetector custom = (CustomRuleDetector) detectors.get(1);
        assertEquals(List.of("badge"), custom.ruleNames());
        var found = custom.detect("badge EMP-123456 issued", DetectionOptions.defaults());
        assertEquals(1, found.size());
        assertEquals("EMP-123456", found.get(0).text());
    }

    @Test
    public void unnamedRulesGetGeneratedNames() {
        List<Detector> detectors = registry.build(
                EnumSet.of(DetectorType.CUSTOM_RULES), List.of(CustomRule.of("X-\\d+", EntityType.CUSTOM, 0.7)));
        CustomRuleDetector custom = (CustomRuleDetector) detectors.get(0);
        assertEquals(List.of("custom_1"), custom.ruleNames());
    }

    @Test
    public void brokenRulePatternIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> registry.build(null, List.of(CustomRule.of("([unclosed", EntityType.CUSTOM, 0.7))));
    }

    @Test
    public void customRuleValuesAreChecked() {
        assertThrows(IllegalArgumentException.class, () -> CustomRule.of("x", EntityType.CUSTOM, 1.5));
        assertEquals(EntityType.CUSTOM, CustomRule.of("x", null, 0.5).type());
    }
}
