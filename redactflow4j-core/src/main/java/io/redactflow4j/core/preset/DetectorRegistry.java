/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.preset;

import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.model.DetectorType;
import io.redactflow4j.core.detect.*;
import java.util.*;

/**
 * Builds a list of {@link Detector} instances from logical {@link DetectorType}s and the configured
 * {@link CustomRule}s.
 *
 * <p>The {@link CustomRuleDetector} is added whenever custom rules are configured, even if
 * {@link DetectorType#CUSTOM_RULES} was not listed, so declared rules are never silently ignored.</p>
 *
 * <h3>Detector ordering</h3>
 * <ul>
 *   <li><b>1.</b> General pattern detectors</li>
 *   <li><b>2.</b> Checksum-gated detectors (cards, IBAN) and IP addresses</li>
 *   <li><b>3.</b> Domain detectors (financial, healthcare)</li>
 *   <li><b>4.</b> Statistical name heuristic</li>
 *   <li><b>5.</b> Knowledge base definitions</li>
 *   <li><b>6.</b> Custom rules</li>
 * </ul>
 *
 * <p>{@link DetectorType#KNOWLEDGE_BASE} only runs when listed explicitly.</p>
 */
public final class DetectorRegistry {

    /** Default enabled detectors: everything except the knowledge base. */
    public static EnumSet<DetectorType> defaultTypes() {
        return EnumSet.complementOf(EnumSet.of(DetectorType.KNOWLEDGE_BASE));
    }

    /**
     * Build detectors in a deterministic order.
     *
     * @param types the logical types enabled in config (may be null/empty)
     * @param customRules rules to preload into the custom rule detector (may be null)
     * @return immutable list of active detectors
     * @throws IllegalArgumentException if a custom rule pattern does not compile
     */
    public List<Detector> build(Collection<DetectorType> types, List<CustomRule> customRules) {
        EnumSet<DetectorType> enabled =
                (types == null || types.isEmpty()) ? defaultTypes() : EnumSet.copyOf(types);
        List<CustomRule> rules = customRules == null ? List.of() : customRules;

        List<Detector> out = new ArrayList<>();
        if (enabled.contains(DetectorType.RULE_BASED)) out.add(new RuleBasedDetector());

        if (enabled.contains(DetectorType.CREDIT_CARD)) out.add(new CreditCardDetector());
        if (enabled.contains(DetectorType.IBAN)) out.add(new IbanDetector());
        if (enabled.contains(DetectorType.IP)) out.add(new IpDetector());

        if (enabled.contains(DetectorType.FINANCIAL)) out.add(new FinancialDetector());
        if (enabled.contains(DetectorType.HEALTHCARE)) out.add(new HealthcareDetector());

        if (enabled.contains(DetectorType.PERSON_NAME)) out.add(new PersonNameDetector());
        if (enabled.contains(DetectorType.KNOWLEDGE_BASE)) out.add(new KnowledgeBaseDetector());

        if (enabled.contains(DetectorType.CUSTOM_RULES) || !rules.isEmpty()) {
            CustomRuleDetector custom = new CustomRuleDetector();
            for (CustomRule r : rules) {
                if (r.name() == null || r.name().isBlank()) {
                    custom.addRule(r.pattern(), r.type(), r.confidence(), r.label());
                } else {
                    custom.addRule(r.name(), r.pattern(), r.type(), r.confidence(), r.label());
                }
            }
            out.add(custom);
        }
        return List.copyOf(out);
    }

    public List<Detector> defaults() {
        return build(defaultTypes(), List.of());
    }
}
