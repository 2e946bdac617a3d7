/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.EntityType;
import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/** Synthetic stand-ins shaped like the type they replace. Not stable across calls unless seeded. */
final class Pseudonymizer {
    private static final List<String> FIRST_NAMES =
            List.of("John", "Jane", "Alex", "Sam", "Taylor", "Morgan", "Jordan", "Casey");
    private static final List<String> LAST_NAMES =
            List.of("Smith", "Johnson", "Williams", "Brown", "Jones", "Miller", "Davis");

    private final Random random;

    Pseudonymizer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Seeded instances repeat their sequence; unseeded ones draw from a secure source. */
    static Pseudonymizer create(Long seed) {
        return new Pseudonymizer(seed == null ? new SecureRandom() : new Random(seed));
    }

    String pseudonym(EntityType type, String original) {
        switch (type) {
            case PERSON:
                String first = pick(FIRST_NAMES);
                return original.trim().split("\\s+").length == 1 ? first : first + " " + pick(LAST_NAMES);
            case EMAIL:
                return "user" + hex8() + "@example.com";
            case PHONE:
                return String.format(Locale.ROOT, "(555) 000-%04d", random.nextInt(10_000));
            case ADDRESS:
                return random.nextInt(1000) + " Main Street, Anytown, USA";
            default:
                return "PSEUDONYM_" + type.id() + "_" + hex8();
        }
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private String hex8() {
        return String.format(Locale.ROOT, "%08x", random.nextInt());
    }
}
