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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class HealthcareDetectorTest {

    private final HealthcareDetector detector = new HealthcareDetector();

    @ParameterizedTest
    @CsvSource({
        "'MRN: 1234567', MEDICAL_RECORD_NUMBER, 1234567",
        "'Insurance ID: ABC123456', HEALTH_INSURANCE_ID, ABC123456",
        "'Medicare 123456789', HEALTH_INSURANCE_ID, 123456789",
        "'Patient ID: P123456', PATIENT_ID, P123456",
        "'Diagnosis: E11.9', CUSTOM, E11.9",
        "'CPT 99213', CUSTOM, 99213"
    })
    public void claimsKeyedIdentifiers(String text, EntityType type, String value) {
        List<Candidate> found = detector.detect(text, DetectionOptions.defaults());
        Candidate c = found.stream()
                .filter(x -> x.type() == type)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + type + " in " + text));
        assertEquals(value, c.text());
    }

    @Test
    public void codesCarryTheirCustomLabel() {
        Candidate c = detector.detect("ICD-10: J45.20", DetectionOptions.defaults()).get(0);
        assertEquals("diagnosis_code", c.attributes().get(Candidate.CUSTOM_TYPE_ATTRIBUTE));
    }

    @Test
    public void wordsAfterAKeywordAreNotIdentifiers() {
        assertTrue(detector.detect("Patient: RECOVERING well", DetectionOptions.defaults()).isEmpty());
    }
}
