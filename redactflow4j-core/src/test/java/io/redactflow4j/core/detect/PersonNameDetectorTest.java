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
import java.util.Set;
import org.junit.jupiter.api.Test;

public class PersonNameDetectorTest {

    private final PersonNameDetector detector = new PersonNameDetector();

    @Test
    public void givenNameFollowedBySurnameAfterACapitalizedWord() {
        String text = "Contact John Smith at the office";
        List<Candidate> found = detector.detect(text, DetectionOptions.defaults());

        assertEquals(1, found.size());
        Candidate c = found.get(0);
        assertEquals("John Smith", c.text());
        assertEquals(8, c.start());
        assertEquals(0.85, c.confidence());
        assertEquals("given_name", c.attributes().get(PersonNameDetector.RULE_ATTRIBUTE));
    }

    @Test
    public void honorificCoversTheNameOnly() {
        List<Candidate> found = detector.detect("Referred by Dr. Gregory House today", DetectionOptions.defaults());

        assertEquals(1, found.size());
        assertEquals("Gregory House", found.get(0).text());
        assertEquals(0.9, found.get(0).confidence());
    }

    @Test
    public void placeNamesAreNotSurnames() {
        assertTrue(detector.detect("Meet me on Mary Street", DetectionOptions.defaults()).isEmpty());
    }

    @Test
    public void customGazetteer() {
        PersonNameDetector custom = new PersonNameDetector(Set.of("Zoltan"));
        assertEquals(1, custom.detect("ask Zoltan Kovacs", DetectionOptions.defaults()).size());
        assertTrue(custom.detect("ask John Smith", DetectionOptions.defaults()).isEmpty());
    }

    @Test
    public void silentWhenPersonsAreNotRequested() {
        DetectionOptions emails = DetectionOptions.defaults().withEntityTypes(EntityType.EMAIL);
        assertTrue(detector.detect("John Smith", emails).isEmpty());
    }
}
