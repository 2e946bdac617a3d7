/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CreditCardDetectorTest {

    private final CreditCardDetector detector = new CreditCardDetector();

    @ParameterizedTest
    @CsvSource({
        "4532015112830366, true",
        "4532015112830367, false",
        "4111111111111111, true",
        "378282246310005, true",
        "1234567890123456, false",
        "'', false",
        "4111-1111, false"
    })
    public void testLuhn(String number, boolean valid) {
        assertEquals(valid, CreditCardDetector.luhn(number));
    }

    @Test
    public void findsSeparatedCardNumbers() {
        String text = "Card: 4111 1111 1111 1111 expires soon";
        List<Candidate> found = detector.detect(text, DetectionOptions.defaults());

        assertEquals(1, found.size());
        Candidate c = found.get(0);
        assertEquals(EntityType.CREDIT_CARD, c.type());
        assertEquals("4111 1111 1111 1111", c.text());
        assertEquals(text.indexOf("4111"), c.start());
        assertEquals("visa", c.attributes().get(CreditCardDetector.BRAND_ATTRIBUTE));
        assertEquals(CreditCardDetector.NAME, c.source());
    }

    @Test
    public void ignoresNumbersFailingLuhn() {
        assertTrue(detector.detect("order 4532015112830367 shipped", DetectionOptions.defaults()).isEmpty());
    }

    @Test
    public void staysSilentWhenCardsWereNotRequested() {
        DetectionOptions onlyEmail = DetectionOptions.defaults().withEntityTypes(EntityType.EMAIL);
        assertTrue(detector.detect("4111111111111111", onlyEmail).isEmpty());
    }

    @Test
    public void brandsByPrefix() {
        assertEquals("amex", CreditCardDetector.brand("378282246310005"));
        assertEquals("mastercard", CreditCardDetector.brand("5555555555554444"));
        assertEquals("discover", CreditCardDetector.brand("6011111111111117"));
    }
}
