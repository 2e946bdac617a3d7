/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import io.redactflow4j.core.api.PipelineSettings;
import io.redactflow4j.core.api.model.DetectorType;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RedactionStrategy;
import io.redactflow4j.core.preset.CustomRule;
import io.redactflow4j.core.redact.RedactionOptions;
import io.redactflow4j.core.redact.TokenKey;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "redactflow4j")
public class RedactflowProperties {

    @Setter
    private boolean enabled = true;

    @Setter
    private double confidenceThreshold = 0.5;

    @Setter
    private double mergeThreshold = 0.7;

    @Setter
    private Duration detectorTimeout = Duration.ofSeconds(5);

    /** Size of the recent-findings ring kept for the actuator endpoint. */
    @Setter
    private int recentFindings = 200;

    private List<DetectorType> detectors = new ArrayList<>();
    private List<Rule> customRules = new ArrayList<>();
    private Redaction redaction = new Redaction();

    public List<DetectorType> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<DetectorType> detectors) {
        this.detectors = new ArrayList<>(Objects.requireNonNullElse(detectors, List.of()));
    }

    public List<Rule> getCustomRules() {
        return Collections.unmodifiableList(customRules);
    }

    public void setCustomRules(List<Rule> rules) {
        this.customRules = new ArrayList<>(Objects.requireNonNullElse(rules, List.of()));
    }

    public void setRedaction(Redaction r) {
        this.redaction = (r == null) ? new Redaction() : r;
    }

    public PipelineSettings toSettings() {
        return new PipelineSettings(confidenceThreshold, mergeThreshold, detectorTimeout);
    }

    public List<CustomRule> toCustomRules() {
        List<CustomRule> out = new ArrayList<>(customRules.size());
        for (Rule r : customRules) {
            out.add(new CustomRule(r.getName(), r.getPattern(), r.getType(), r.getConfidence(), r.getLabel()));
        }
        return out;
    }

    // ---- nested: custom-rules[] ----
    @Getter
    @Setter
    public static final class Rule {
        private String name; // null = generated
        private String pattern;
        private EntityType type = EntityType.CUSTOM;
        private double confidence = 0.8;
        private String label;
    }

    // ---- nested: redaction ----
    @Getter
    @Setter
    public static final class Redaction {
        private RedactionStrategy strategy = RedactionStrategy.PARTIAL_MASK;
        private Map<EntityType, RedactionStrategy> strategies = new EnumMap<>(EntityType.class);
        private Map<EntityType, String> replacements = new EnumMap<>(EntityType.class); // literal, beats strategies
        private Character maskChar = RedactionOptions.DEFAULT_MASK_CHAR;
        private boolean preserveFormat = true;
        private boolean preserveLength = true;
        private String tokenSecret; // null = hash tokens only
        private Long pseudonymSeed;

        public RedactionOptions toOptions() {
            RedactionOptions o = RedactionOptions.defaults()
                    .withDefaultStrategy(strategy)
                    .withMaskChar(maskChar == null ? RedactionOptions.DEFAULT_MASK_CHAR : maskChar)
                    .withPreserveFormat(preserveFormat)
                    .withPreserveLength(preserveLength)
                    .withPseudonymSeed(pseudonymSeed);
            if (strategies != null) {
                for (Map.Entry<EntityType, RedactionStrategy> e : strategies.entrySet()) {
                    o = o.withStrategy(e.getKey(), e.getValue());
                }
            }
            if (replacements != null) {
                for (Map.Entry<EntityType, String> e : replacements.entrySet()) {
                    o = o.withCustomReplacement(e.getKey(), e.getValue());
                }
            }
            if (tokenSecret != null && !tokenSecret.isBlank()) o = o.withTokenKey(TokenKey.derive(tokenSecret));
            return o;
        }
    }
}
