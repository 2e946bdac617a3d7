/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-supplied regex rules that can be added and removed while the pipeline is serving. Runs see a
 * consistent snapshot of the table as it was when they started scanning.
 */
public final class CustomRuleDetector extends RegexDetector {
    private static final Logger log = LoggerFactory.getLogger(CustomRuleDetector.class);

    public static final String NAME = "custom_rules";
    public static final double DEFAULT_CONFIDENCE = 0.8;

    private final CopyOnWriteArrayList<PatternRule> table = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();

    public CustomRuleDetector() {
        super(NAME, DetectorKind.PATTERN, List.of());
    }

    @Override
    protected List<PatternRule> rules() {
        return List.copyOf(table);
    }

    /**
     * Adds a rule and returns its generated name.
     *
     * @param label shown as {@code custom_type} when {@code type} is {@link EntityType#CUSTOM}; may be null
     * @throws IllegalArgumentException if the regex does not compile
     */
    public String addRule(String regex, EntityType type, double confidence, String label) {
        String name = "custom_" + sequence.incrementAndGet();
        return addRule(name, regex, type, confidence, label);
    }

    public String addRule(String name, String regex, EntityType type, double confidence, String label) {
        Objects.requireNonNull(regex, "regex");
        EntityType effective = type == null ? EntityType.CUSTOM : type;
        Pattern compiled;
        try {
            compiled = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid custom rule pattern '" + regex + "': " + e.getDescription(), e);
        }
        Map<String, String> attrs = effective == EntityType.CUSTOM && label != null && !label.isBlank()
                ? Map.of(Candidate.CUSTOM_TYPE_ATTRIBUTE, label)
                : Map.of();
        PatternRule rule = new PatternRule(name, compiled, effective, confidence, null, attrs);
        table.removeIf(r -> r.name().equals(name));
        table.add(rule);
        log.debug("Custom rule '{}' registered for type {}", name, effective.id());
        return name;
    }

    public boolean removeRule(String name) {
        boolean removed = table.removeIf(r -> r.name().equals(name));
        if (removed) log.debug("Custom rule '{}' removed", name);
        return removed;
    }

    public List<String> ruleNames() {
        return table.stream().map(PatternRule::name).toList();
    }

    public int size() {
        return table.size();
    }
}
