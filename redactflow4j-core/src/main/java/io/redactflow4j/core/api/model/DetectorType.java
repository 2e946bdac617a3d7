/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import java.util.Locale;

/** Logical built-in detectors users switch on in configuration. */
public enum DetectorType {
    RULE_BASED, // contact data, government ids, dates, addresses
    CREDIT_CARD, // Luhn
    IBAN, // MOD-97
    IP,
    FINANCIAL, // keyword-anchored account/routing/tax/crypto
    HEALTHCARE, // MRN, insurance, patient ids
    PERSON_NAME, // gazetteer heuristic
    KNOWLEDGE_BASE, // entity definitions with context keywords; opt-in
    CUSTOM_RULES; // runtime user regexes

    public static DetectorType fromId(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("detector type is blank");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
