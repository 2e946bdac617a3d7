/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.enrich;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Context;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.Validation;
import io.redactflow4j.core.api.model.ValidationStatus;
import io.redactflow4j.core.detect.FinancialDetector;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CandidateValidatorTest {

    private final CandidateValidator validator = new CandidateValidator();

    private static Candidate cand(EntityType type, String text) {
        return Candidate.of(type, text, 0, text.length(), 0.9, "test");
    }

    private static Context plain(String entity) {
        return new Context("Reach me: ", entity, " thanks.");
    }

    @ParameterizedTest
    @CsvSource({
        "EMAIL, john.smith@company.com, PASS",
        "EMAIL, john..smith@company.com, FAIL",
        "EMAIL, nobody@localhost, FAIL",
        "PHONE, 555-123-4567, PASS",
        "PHONE, 12-34, FAIL",
        "SSN, 123-45-6789, PASS",
        "SSN, 666-45-6789, FAIL",
        "CREDIT_CARD, 4111 1111 1111 1111, PASS",
        "CREDIT_CARD, 4111 1111 1111 1112, FAIL",
        "IBAN, DE89 3704 0044 0532 0130 00, PASS",
        "IBAN, DE00 3704 0044 0532 0130 00, FAIL",
        "IP_ADDRESS, 192.168.0.1, PASS",
        "IP_ADDRESS, 300.1.1.1, FAIL",
        "IP_ADDRESS, fe80::1, PASS",
        "DATE, 12/31/2023, PASS",
        "DATE, 2024-02-29, PASS",
        "DATE, 2023-02-29, FAIL",
        "DATE_OF_BIRTH, 31.12.1980, PASS",
        "URL, https://example.com, NOT_APPLICABLE",
        "PERSON, John Smith, NOT_APPLICABLE"
    })
    public void formatChecksByType(EntityType type, String value, ValidationStatus expected) {
        Validation v = validator.validate(cand(type, value), plain(value));
        assertEquals(expected, v.status(Validation.FORMAT_VALID));
    }

    @Test
    public void cardSideValuesAreNotJudgedAsCardNumbers() {
        Candidate cvv = cand(EntityType.CREDIT_CARD, "123").withAttribute(FinancialDetector.SUBTYPE_ATTRIBUTE, "cvv");
        assertEquals(ValidationStatus.NOT_APPLICABLE, validator.format(cvv));
    }

    @ParameterizedTest
    @CsvSource({
        "'This is a test: ', FAIL",
        "'Use the sample number ', FAIL",
        "'Contact ', PASS",
        "'Attestation ', PASS"
    })
    public void suspiciousWordsInContext(String before, ValidationStatus expected) {
        Context ctx = new Context(before, "555-123-4567", " now");
        assertEquals(expected, CandidateValidator.contextAppropriate(ctx));
    }

    @Test
    public void suspiciousWordInsideTheEntityDoesNotCount() {
        Context ctx = new Context("Mail ", "test@company.com", " today");
        assertEquals(ValidationStatus.PASS, CandidateValidator.contextAppropriate(ctx));
    }

    @Test
    public void stopWordsAreNotPersons() {
        assertEquals(ValidationStatus.FAIL, CandidateValidator.notCommonWord(cand(EntityType.PERSON, "The")));
        assertEquals(ValidationStatus.PASS, CandidateValidator.notCommonWord(cand(EntityType.PERSON, "John Smith")));
        assertEquals(
                ValidationStatus.NOT_APPLICABLE, CandidateValidator.notCommonWord(cand(EntityType.EMAIL, "the")));
    }

    @Test
    public void lengthBounds() {
        assertEquals(ValidationStatus.PASS, CandidateValidator.length("a"));
        assertEquals(ValidationStatus.FAIL, CandidateValidator.length("   "));
        assertEquals(ValidationStatus.FAIL, CandidateValidator.length("x".repeat(101)));
    }

    @Test
    public void checksAreReportedInEvaluationOrder() {
        Validation v = validator.validate(cand(EntityType.EMAIL, "a@b.io"), plain("a@b.io"));
        assertEquals(
                List.of(Validation.FORMAT_VALID, Validation.CONTEXT_APPROPRIATE, Validation.NOT_COMMON_WORD,
                        Validation.LENGTH_APPROPRIATE),
                List.copyOf(v.checks().keySet()));
    }
}
