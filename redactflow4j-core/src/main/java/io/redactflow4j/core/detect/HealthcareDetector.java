/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static io.redactflow4j.core.api.model.EntityType.*;

import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;

/** Keyword-anchored medical identifiers (record numbers, insurance and patient ids, coded diagnoses). */
public final class HealthcareDetector extends RegexDetector {
    public static final String NAME = "healthcare";
    public static final String SUBTYPE_ATTRIBUTE = "healthcare_subtype";

    private static final String KV = "\\s*[:#]?\\s*";
    // at least one digit, so plain words after a keyword are never claimed
    private static final String ALNUM_ID = "(?=[A-Z]*\\d)[A-Z0-9]";

    public HealthcareDetector() {
        super(NAME, DetectorKind.DOMAIN, defaultRules());
    }

    static List<PatternRule> defaultRules() {
        return List.of(
                keyed("mrn", "(?i:MRN|Medical\\s+Record(?:\\s+(?:Number|No\\.?))?)" + KV + "(?<val>\\d{5,10})\\b",
                        MEDICAL_RECORD_NUMBER, 0.9, "mrn"),
                keyed("insurance_id",
                        "(?i:Insurance\\s+ID|Policy(?:\\s+(?:Number|No\\.?))?|Member\\s+ID|BCBS)" + KV + "(?<val>"
                                + ALNUM_ID + "{6,15})\\b",
                        HEALTH_INSURANCE_ID, 0.85, "insurance_id"),
                keyed("group_number", "(?i:Group(?:\\s+(?:Number|No\\.?))?)" + KV + "(?<val>" + ALNUM_ID + "{5,10})\\b",
                        HEALTH_INSURANCE_ID, 0.8, "group_number"),
                keyed("medicare", "(?i:Medicare|Medicaid)" + KV + "(?<val>\\d{6,12})\\b",
                        HEALTH_INSURANCE_ID, 0.85, "government_plan"),
                keyed("patient_id", "(?i:Patient\\s+ID|Patient|PT)" + KV + "(?<val>" + ALNUM_ID + "{5,15})\\b",
                        PATIENT_ID, 0.9, "patient_id"),
                keyed("diagnosis_code", "(?i:ICD-10|Diagnosis|DX)" + KV + "(?<val>[A-Z]\\d{2}\\.\\d{1,2})\\b",
                        CUSTOM, 0.85, "diagnosis_code")
                        .withAttribute(Candidate.CUSTOM_TYPE_ATTRIBUTE, "diagnosis_code"),
                keyed("procedure_code", "(?i:CPT|Procedure)" + KV + "(?<val>\\d{5})\\b",
                        CUSTOM, 0.85, "procedure_code")
                        .withAttribute(Candidate.CUSTOM_TYPE_ATTRIBUTE, "procedure_code"));
    }

    private static PatternRule keyed(String name, String regex, EntityType type, double confidence, String subtype) {
        return PatternRule.of(name, "\\b" + regex, type, confidence).withAttribute(SUBTYPE_ATTRIBUTE, subtype);
    }
}
