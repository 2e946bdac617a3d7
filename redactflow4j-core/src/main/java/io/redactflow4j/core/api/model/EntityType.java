/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of personal data a detector can claim. {@link #CUSTOM} is the overflow variant for
 * user-defined rules; its concrete label travels in the candidate attributes under
 * {@link Candidate#CUSTOM_TYPE_ATTRIBUTE}.
 */
public enum EntityType {
    EMAIL("email", RiskLevel.HIGH, "[EMAIL]"),
    PHONE("phone", RiskLevel.HIGH, "[PHONE NUMBER]"),
    SSN("ssn", RiskLevel.CRITICAL, "[SSN]"),
    PAN("pan", RiskLevel.CRITICAL, "[PAN]"),
    CREDIT_CARD("credit_card", RiskLevel.CRITICAL, "[PAYMENT CARD]"),
    PERSON("person", RiskLevel.HIGH, "[PERSON]"),
    ORGANIZATION("organization", RiskLevel.LOW, "[ORGANIZATION]"),
    LOCATION("location", RiskLevel.LOW, "[LOCATION]"),
    DATE("date", RiskLevel.MEDIUM, "[DATE]"),
    DATE_OF_BIRTH("date_of_birth", RiskLevel.HIGH, "[DOB]"),
    ADDRESS("address", RiskLevel.MEDIUM, "[ADDRESS]"),
    IBAN("iban", RiskLevel.CRITICAL, "[IBAN]"),
    IP_ADDRESS("ip_address", RiskLevel.MEDIUM, "[IP ADDRESS]"),
    URL("url", RiskLevel.LOW, "[URL]"),
    PASSPORT("passport", RiskLevel.CRITICAL, "[PASSPORT]"),
    DRIVERS_LICENSE("drivers_license", RiskLevel.HIGH, "[DRIVER'S LICENSE]"),
    BANK_ACCOUNT("bank_account", RiskLevel.CRITICAL, "[BANK ACCOUNT]"),
    TAX_ID("tax_id", RiskLevel.CRITICAL, "[TAX ID]"),
    MEDICAL_RECORD_NUMBER("medical_record_number", RiskLevel.HIGH, "[MEDICAL RECORD]"),
    HEALTH_INSURANCE_ID("health_insurance_id", RiskLevel.HIGH, "[INSURANCE ID]"),
    PATIENT_ID("patient_id", RiskLevel.HIGH, "[PATIENT ID]"),
    CRYPTO_ADDRESS("crypto_address", RiskLevel.HIGH, "[CRYPTO ADDRESS]"),
    GPS_COORDINATES("gps_coordinates", RiskLevel.MEDIUM, "[GPS COORDINATES]"),
    CUSTOM("custom", RiskLevel.MEDIUM, "[CUSTOM]");

    private final String id;
    private final RiskLevel baseRisk;
    private final String placeholder;

    EntityType(String id, RiskLevel baseRisk, String placeholder) {
        this.id = id;
        this.baseRisk = baseRisk;
        this.placeholder = placeholder;
    }

    /** Stable serialization id, e.g. {@code credit_card}. */
    @JsonValue
    public String id() {
        return id;
    }

    /** Risk before any confidence-based downgrade. */
    public RiskLevel baseRisk() {
        return baseRisk;
    }

    /** Category token used by the generalization strategy. */
    public String placeholder() {
        return placeholder;
    }

    @JsonCreator
    public static EntityType fromId(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("entity type id is blank");
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EntityType t : values()) {
            if (t.id.equals(key) || t.name().equalsIgnoreCase(key)) return t;
        }
        throw new IllegalArgumentException("Unknown entity type: " + raw);
    }
}
