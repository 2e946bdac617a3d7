/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Context;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RiskLevel;
import io.redactflow4j.core.api.model.Validation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MicrometerReporterTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private static DetectedEntity entity(EntityType type, String value, String source) {
        Candidate c = Candidate.of(type, value, 0, value.length(), 0.9, source);
        return new DetectedEntity(c, RiskLevel.HIGH, new Validation(Map.of()), new Context("", value, ""));
    }

    @Test
    void countsByTypeAndDetector() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 50);
        reporter.report(List.of(
                entity(EntityType.EMAIL, "a@b.io", "rule_based"),
                entity(EntityType.EMAIL, "c@d.io", "rule_based"),
                entity(EntityType.PERSON, "John Smith", "person_name")));

        assertThat(registry.get(MicrometerReporter.COUNTER)
                        .tags("type", "email", "detector", "rule_based")
                        .counter()
                        .count())
                .isEqualTo(2.0);
        assertThat(registry.get(MicrometerReporter.COUNTER)
                        .tags("type", "person", "detector", "person_name")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    void ringIsBoundedAndKeepsTheNewest() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 1);
        assertThat(reporter.capacity()).isEqualTo(MicrometerReporter.MIN_CAPACITY);

        List<DetectedEntity> batch = new ArrayList<>();
        for (int i = 0; i < 15; i++) batch.add(entity(EntityType.PHONE, "555-000-00" + (10 + i), "rule_based"));
        reporter.report(batch);

        List<MicrometerReporter.RecentFinding> recent = reporter.recentFindings();
        assertThat(recent).hasSize(10);
        assertThat(recent.get(0).type()).isEqualTo("phone");
        assertThat(recent.get(0).riskLevel()).isEqualTo("high");
    }

    @Test
    void recentFindingsNeverCarryTheMatchedText() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 10);
        reporter.report(List.of(entity(EntityType.SSN, "123-45-6789", "rule_based")));

        assertThat(reporter.recentFindings().get(0).toString()).doesNotContain("123-45-6789");
    }

    @Test
    void emptyBatchesAreIgnored() {
        MicrometerReporter reporter = new MicrometerReporter(registry, 10);
        reporter.report(List.of());
        reporter.report(null);
        assertThat(reporter.recentFindings()).isEmpty();
        assertThat(registry.find(MicrometerReporter.COUNTER).counter()).isNull();
    }
}
