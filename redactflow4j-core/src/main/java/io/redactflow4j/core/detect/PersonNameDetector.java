/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight person-name heuristic: a known given name followed by a capitalized surname, or an
 * honorific followed by one or two capitalized words. Scores are fixed per rule, not model outputs.
 */
public final class PersonNameDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(PersonNameDetector.class);

    public static final String NAME = "person_name";
    public static final String RULE_ATTRIBUTE = "name_rule";

    static final double GIVEN_NAME_CONFIDENCE = 0.85;
    static final double HONORIFIC_CONFIDENCE = 0.9;

    private static final Pattern GIVEN_SURNAME = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?<first>[A-Z][a-z]+)(?:\\s+[A-Z]\\.)?\\s+(?<last>[A-Z][a-z]+(?:-[A-Z][a-z]+)?)\\b");
    private static final Pattern HONORIFIC = Pattern.compile(
            "\\b(?:Mr|Mrs|Ms|Miss|Dr|Prof)\\.?\\s+(?<val>[A-Z][a-z]+(?:\\s+[A-Z]\\.)?(?:\\s+[A-Z][a-z]+(?:-[A-Z][a-z]+)?)?)\\b");

    private static final Set<String> DEFAULT_GIVEN_NAMES = Set.of(
            "James", "John", "Robert", "Michael", "William", "David", "Richard", "Joseph", "Thomas", "Charles",
            "Christopher", "Daniel", "Matthew", "Anthony", "Mark", "Donald", "Steven", "Paul", "Andrew", "Joshua",
            "Kevin", "Brian", "George", "Edward", "Ronald", "Timothy", "Jason", "Jeffrey", "Ryan", "Jacob",
            "Gary", "Eric", "Peter", "Frank", "Scott", "Alex", "Sam", "Jordan", "Taylor", "Morgan",
            "Mary", "Patricia", "Jennifer", "Linda", "Elizabeth", "Barbara", "Susan", "Jessica", "Sarah", "Karen",
            "Nancy", "Lisa", "Betty", "Margaret", "Sandra", "Ashley", "Kimberly", "Emily", "Donna", "Michelle",
            "Dorothy", "Carol", "Amanda", "Melissa", "Deborah", "Stephanie", "Rebecca", "Laura", "Sharon", "Cynthia",
            "Kathleen", "Amy", "Anna", "Emma", "Olivia", "Sophia", "Maria", "Jane", "Alice", "Julia",
            "Hans", "Pierre", "Marie", "Juan", "Carlos", "Luis", "Ahmed", "Mohammed", "Wei", "Hiroshi");

    private static final Set<String> NOT_SURNAMES = Set.of(
            "Street", "Avenue", "Road", "Boulevard", "Lane", "Drive", "Court", "Place", "Square", "Park",
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday",
            "January", "February", "March", "April", "May", "June", "July", "August", "September", "October",
            "November", "December", "Inc", "Corp", "Ltd", "Hospital", "Bank", "University");

    private final Set<String> givenNames;

    public PersonNameDetector() {
        this(DEFAULT_GIVEN_NAMES);
    }

    public PersonNameDetector(Set<String> givenNames) {
        this.givenNames = Set.copyOf(Objects.requireNonNull(givenNames, "givenNames"));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public Set<EntityType> supportedTypes() {
        return Set.of(EntityType.PERSON);
    }

    @Override
    public List<Candidate> detect(String text, DetectionOptions options) {
        if (text == null || text.isEmpty()) return List.of();
        if (options != null && !options.wants(EntityType.PERSON)) return List.of();
        try {
            List<Candidate> out = new ArrayList<>();
            scanGivenNames(text, out);
            scanHonorifics(text, out);
            return out;
        } catch (RuntimeException e) {
            log.warn("Detector '{}' failed: {}", NAME, e.toString());
            return List.of();
        }
    }

    private void scanGivenNames(String text, List<Candidate> out) {
        Matcher m = GIVEN_SURNAME.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            String first = m.group("first");
            String last = m.group("last");
            if (givenNames.contains(first) && !NOT_SURNAMES.contains(last)) {
                out.add(candidate(text, m.start(), m.end(), GIVEN_NAME_CONFIDENCE, "given_name"));
                from = m.end();
            } else {
                // "Contact John Smith": retry from the second word
                from = m.end("first");
            }
        }
    }

    private static void scanHonorifics(String text, List<Candidate> out) {
        Matcher m = HONORIFIC.matcher(text);
        while (m.find()) {
            out.add(candidate(text, m.start("val"), m.end("val"), HONORIFIC_CONFIDENCE, "honorific"));
        }
    }

    private static Candidate candidate(String text, int start, int end, double confidence, String rule) {
        return Candidate.of(EntityType.PERSON, text.substring(start, end), start, end, confidence, NAME)
                .withAttribute(RULE_ATTRIBUTE, rule);
    }
}
