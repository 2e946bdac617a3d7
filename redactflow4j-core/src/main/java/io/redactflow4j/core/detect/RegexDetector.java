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
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a table of {@link PatternRule}s over the text. Rules for types the run did not ask for are not
 * evaluated at all. A rule that blows up is logged and skipped; the others still report.
 */
public class RegexDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(RegexDetector.class);

    private final String name;
    private final DetectorKind kind;
    private final List<PatternRule> rules;

    public RegexDetector(String name, DetectorKind kind, List<PatternRule> rules) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectorKind kind() {
        return kind;
    }

    /** Current rule table. Subclasses with a mutable table override this. */
    protected List<PatternRule> rules() {
        return rules;
    }

    @Override
    public Set<EntityType> supportedTypes() {
        List<PatternRule> current = rules();
        if (current.isEmpty()) return Set.of();
        EnumSet<EntityType> types = EnumSet.noneOf(EntityType.class);
        for (PatternRule r : current) types.add(r.type());
        return Collections.unmodifiableSet(types);
    }

    @Override
    public List<Candidate> detect(String text, DetectionOptions options) {
        if (text == null || text.isEmpty()) return List.of();
        DetectionOptions opts = options == null ? DetectionOptions.defaults() : options;
        List<Candidate> out = new ArrayList<>();
        for (PatternRule rule : rules()) {
            if (!opts.wants(rule.type())) continue;
            try {
                scan(text, rule, out);
            } catch (RuntimeException e) {
                log.warn("Detector '{}' rule '{}' failed: {}", name, rule.name(), e.toString());
            }
        }
        return out;
    }

    private void scan(String text, PatternRule rule, List<Candidate> out) {
        boolean keyed = rule.hasValueGroup();
        Matcher m = rule.pattern().matcher(text);
        while (m.find()) {
            int s = keyed ? m.start(PatternRule.VALUE_GROUP) : m.start();
            int e = keyed ? m.end(PatternRule.VALUE_GROUP) : m.end();
            if (s < 0 || s >= e) continue;
            String value = text.substring(s, e);
            if (!rule.accept().test(value)) continue;
            out.add(toCandidate(rule, value, s, e));
        }
    }

    protected Candidate toCandidate(PatternRule rule, String value, int start, int end) {
        Map<String, String> attrs = new HashMap<>(rule.attributes());
        attrs.put(PatternRule.PATTERN_NAME_ATTRIBUTE, rule.name());
        return Candidate.of(rule.type(), value, start, end, rule.confidence(), name)
                .withAttributes(attrs);
    }
}
