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
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class RuleBasedDetectorTest {

    private final RuleBasedDetector detector = new RuleBasedDetector();

    private List<Candidate> detect(String text) {
        return detector.detect(text, DetectionOptions.defaults());
    }

    private Optional<Candidate> first(List<Candidate> found, EntityType type) {
        return found.stream().filter(c -> c.type() == type).findFirst();
    }

    @ParameterizedTest
    @CsvSource({
        "'Write to jane.doe@example.org today', EMAIL, jane.doe@example.org",
        "'Call 555-123-4567 now', PHONE, 555-123-4567",
        "'Call (555) 123-4567 now', PHONE, (555) 123-4567",
        "'Call 555.123.4567 now', PHONE, 555.123.4567",
        "'Call +1 555 123 4567 now', PHONE, +1 555 123 4567",
        "'ssn 123-45-6789 on file', SSN, 123-45-6789",
        "'PAN ABCDE1234F issued', PAN, ABCDE1234F",
        "'See https://example.com/a?b=1.', URL, https://example.com/a?b=1",
        "'Ships to 123 Main Street tomorrow', ADDRESS, 123 Main Street",
        "'Visit on 12/31/2023 please', DATE, 12/31/2023",
        "'Logged 2024-02-29 late', DATE, 2024-02-29",
        "'Passport C12345678 presented', PASSPORT, C12345678",
        "'License D1234567 presented', DRIVERS_LICENSE, D1234567",
        "'Pinned at 40.7128, -74.0060 today', GPS_COORDINATES, '40.7128, -74.0060'"
    })
    public void findsEachShape(String text, EntityType type, String expected) {
        Candidate c = first(detect(text), type).orElseThrow(() -> new AssertionError("no " + type + " in " + text));
        assertEquals(expected, c.text());
        assertEquals(expected, text.substring(c.start(), c.end()));
        assertEquals(RuleBasedDetector.NAME, c.source());
        assertNotNull(c.attributes().get(PatternRule.PATTERN_NAME_ATTRIBUTE));
    }

    @Test
    public void keyedDateOfBirthClaimsOnlyTheValue() {
        String text = "DOB: 04/12/1985";
        Candidate dob = first(detect(text), EntityType.DATE_OF_BIRTH).orElseThrow();
        assertEquals("04/12/1985", dob.text());
        assertEquals(5, dob.start());
        assertEquals(0.95, dob.confidence());
    }

    @Test
    public void keyedSsnClaimsOnlyTheValue() {
        List<Candidate> found = detect("SSN: 123 45 6789");
        assertTrue(found.stream()
                .anyMatch(c -> c.type() == EntityType.SSN && c.text().equals("123 45 6789") && c.start() == 5));
    }

    @ParameterizedTest
    @CsvSource({"000-12-3456", "666-12-3456", "912-12-3456", "123-00-4567", "123-45-0000"})
    public void neverIssuedSsnRangesAreRejected(String ssn) {
        assertFalse(RuleBasedDetector.isPlausibleSsn(ssn));
        assertTrue(first(detect("id " + ssn), EntityType.SSN).isEmpty());
    }

    @Test
    public void compactTenDigitPhoneGetsLowerConfidence() {
        Candidate c = first(detect("phone 5551234567"), EntityType.PHONE).orElseThrow();
        assertEquals(0.6, c.confidence());
    }

    @Test
    public void coordinatesNeedDecimals() {
        assertTrue(first(detect("items 12, 34"), EntityType.GPS_COORDINATES).isEmpty());
    }

    @Test
    public void onlyRequestedTypesAreScanned() {
        DetectionOptions phonesOnly = DetectionOptions.defaults().withEntityTypes(EntityType.PHONE);
        List<Candidate> found = detector.detect("mail a@b.io or call 555-123-4567", phonesOnly);
        assertFalse(found.isEmpty());
        assertTrue(found.stream().allMatch(c -> c.type() == EntityType.PHONE));
    }

    @Test
    public void supportsEveryGeneralType() {
        assertTrue(detector.supportedTypes().containsAll(List.of(
                EntityType.EMAIL, EntityType.PHONE, EntityType.SSN, EntityType.URL, EntityType.DATE_OF_BIRTH)));
    }
}
