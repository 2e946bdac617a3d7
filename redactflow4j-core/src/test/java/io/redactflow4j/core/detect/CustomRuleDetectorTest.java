/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CustomRuleDetectorTest {

    @Test
    public void rulesCanBeAddedAndRemovedAtRuntime() {
        CustomRuleDetector detector = new CustomRuleDetector();
        assertTrue(detector.detect("EMP-123456", DetectionOptions.defaults()).isEmpty());

        String name = detector.addRule("EMP-\\d{6}", EntityType.CUSTOM, 0.9, "employee_id");
        List<Candidate> found = detector.detect("badge EMP-123456 issued", DetectionOptions.defaults());

        assertEquals(1, found.size());
        assertEquals("EMP-123456", found.get(0).text());
        assertEquals("employee_id", found.get(0).attributes().get(Candidate.CUSTOM_TYPE_ATTRIBUTE));
        assertEquals(CustomRuleDetector.NAME, found.get(0).source());
        assertTrue(detector.supportedTypes().contains(EntityType.CUSTOM));

        assertTrue(detector.removeRule(name));
        assertTrue(detector.detect("badge EMP-123456 issued", DetectionOptions.defaults()).isEmpty());
        assertFalse(detector.removeRule(name));
    }

    @Test
    public void generatedNamesAreUnique() {
        CustomRuleDetector detector = new CustomRuleDetector();
        String a = detector.addRule("a+", EntityType.CUSTOM, 0.8, null);
        String b = detector.addRule("b+", EntityType.CUSTOM, 0.8, null);
        assertNotEquals(a, b);
        assertEquals(List.of(a, b), detector.ruleNames());
    }

    @Test
    public void sameNameReplacesTheRule() {
        CustomRuleDetector detector = new CustomRuleDetector();
        detector.addRule("order", "ORD-\\d{4}", EntityType.CUSTOM, 0.8, "order");
        detector.addRule("order", "ORD-\\d{6}", EntityType.CUSTOM, 0.8, "order");

        assertEquals(1, detector.size());
        assertTrue(detector.detect("ORD-1234", DetectionOptions.defaults()).isEmpty());
        assertEquals(1, detector.detect("ORD-123456", DetectionOptions.defaults()).size());
    }

    @Test
    public void nullTypeFallsBackToCustom() {
        CustomRuleDetector detector = new CustomRuleDetector();
        detector.addRule("K-\\d{3}", null, 0.7, "key");
        assertEquals(EntityType.CUSTOM, detector.detect("K-123", DetectionOptions.defaults()).get(0).type());
    }

    @Test
    public void invalidRegexIsRejected() {
        CustomRuleDetector detector = new CustomRuleDetector();
        assertThrows(IllegalArgumentException.class, () -> detector.addRule("(unclosed", EntityType.CUSTOM, 0.8, null));
        assertThrows(IllegalArgumentException.class, () -> detector.addRule("ok", EntityType.CUSTOM, 1.5, null));
        assertEquals(0, detector.size());
    }
}
