/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.model.Range;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    public void controlCharsAreRemovedAndOffsetsStillMapBack() {
        String original = "Hello\u0000 World\u0007!";
        ProcessedDocument doc =
                normalizer.normalize(original, List.of(NormalizationStep.REMOVE_CONTROL_CHARS), Map.of());

        assertEquals("Hello World!", doc.processedText());
        assertEquals("2", doc.metadata().get(TextNormalizer.REMOVED_CONTROL_CHARS));

        int start = doc.processedText().indexOf("World");
        Range r = doc.mapRange(start, start + 5);
        assertEquals("World", original.substring(r.start(), r.end()));
    }

    @Test
    public void tabsAndNewlinesAreKept() {
        ProcessedDocument doc = normalizer.normalize(
                "a\tb\r\nc", List.of(NormalizationStep.REMOVE_CONTROL_CHARS), Map.of());
        assertEquals("a\tb\r\nc", doc.processedText());
    }

    @Test
    public void whitespaceRunsCollapseButLineBreaksSurvive() {
        String original = "Call   me\t\tat\n\n555-123-4567";
        ProcessedDocument doc =
                normalizer.normalize(original, List.of(NormalizationStep.NORMALIZE_WHITESPACE), Map.of());

        assertEquals("Call me at\n\n555-123-4567", doc.processedText());
        assertEquals("3", doc.metadata().get(TextNormalizer.COLLAPSED_WHITESPACE));

        int start = doc.processedText().indexOf("555");
        Range r = doc.mapRange(start, start + 12);
        assertEquals("555-123-4567", original.substring(r.start(), r.end()));
    }

    @Test
    public void aLoneTabBecomesASpace() {
        ProcessedDocument doc =
                normalizer.normalize("SSN\t123-45-6789", List.of(NormalizationStep.NORMALIZE_WHITESPACE), Map.of());

        assertEquals("SSN 123-45-6789", doc.processedText());
        assertEquals("0", doc.metadata().get(TextNormalizer.COLLAPSED_WHITESPACE));
        assertEquals(new Range(4, 15), doc.mapRange(4, 15));
    }

    @Test
    public void singleSpacesLeaveTheDocumentUnchanged() {
        ProcessedDocument doc =
                normalizer.normalize("one two three", List.of(NormalizationStep.NORMALIZE_WHITESPACE), Map.of());
        assertEquals("one two three", doc.processedText());
        assertNull(doc.metadata().get(TextNormalizer.COLLAPSED_WHITESPACE));
    }

    @Test
    public void whitespaceNormalizationScalesToLargeInput() {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < 1_000_000) sb.append("word ");
        sb.append("\tend");
        String big = sb.toString();

        ProcessedDocument doc = assertTimeoutPreemptively(
                Duration.ofSeconds(10),
                () -> normalizer.normalize(big, List.of(NormalizationStep.NORMALIZE_WHITESPACE), Map.of()));

        assertEquals(big.length() - 1, doc.processedText().length());
        assertTrue(doc.processedText().endsWith(" end"));
    }

    @Test
    public void sameLengthUnicodeNormalizationMapsExactly() {
        String original = "Card ４１１１";
        ProcessedDocument doc =
                normalizer.normalize(original, List.of(NormalizationStep.NORMALIZE_UNICODE), Map.of());

        assertEquals("Card 4111", doc.processedText());
        assertEquals(new Range(5, 9), doc.mapRange(5, 9));
        assertEquals("true", doc.metadata().get(TextNormalizer.UNICODE_NORMALIZED));
    }

    @Test
    public void lengthChangingNormalizationMakesTheChangedRegionUnmappable() {
        String original = "ﬁle 123";
        ProcessedDocument doc =
                normalizer.normalize(original, List.of(NormalizationStep.NORMALIZE_UNICODE), Map.of());

        assertEquals("file 123", doc.processedText());
        assertEquals(Range.UNMAPPABLE, doc.mapRange(0, 2));
        assertEquals(new Range(-1, -1), doc.mapRange(0, 4));

        Range estimate = doc.estimateRange(0, 2);
        assertFalse(estimate.isUnmappable());
        assertEquals(0, estimate.start());

        // the untouched suffix stays exact
        assertEquals(new Range(4, 7), doc.mapRange(5, 8));
    }

    @Test
    public void languageIsGuessedForEnglishProse() {
        ProcessedDocument doc = normalizer.normalize(
                "The patient is at the clinic and you are in the waiting room",
                List.of(NormalizationStep.DETECT_LANGUAGE),
                Map.of());
        assertEquals("en", doc.metadata().get(TextNormalizer.DETECTED_LANGUAGE));
    }

    @Test
    public void languageIsGuessedForGermanProse() {
        ProcessedDocument doc = normalizer.normalize(
                "Der Patient ist nicht in der Klinik und wartet seit einer Stunde auf den Arzt",
                List.of(NormalizationStep.DETECT_LANGUAGE),
                Map.of());
        assertEquals("de", doc.metadata().get(TextNormalizer.DETECTED_LANGUAGE));
    }

    @Test
    public void languageFailureIsRecordedNotThrown() {
        LanguageGuesser broken = new LanguageGuesser() {
            @Override
            public Optional<String> guess(String text) {
                throw new IllegalStateException("no models");
            }
        };
        ProcessedDocument doc = new TextNormalizer(broken)
                .normalize("The patient is at the clinic", List.of(NormalizationStep.DETECT_LANGUAGE), Map.of());

        assertEquals("no models", doc.metadata().get(TextNormalizer.LANGUAGE_DETECTION_ERROR));
        assertNull(doc.metadata().get(TextNormalizer.DETECTED_LANGUAGE));
    }

    @Test
    public void shortTextGetsNoLanguage() {
        ProcessedDocument doc =
                normalizer.normalize("hi", List.of(NormalizationStep.DETECT_LANGUAGE), Map.of());
        assertNull(doc.metadata().get(TextNormalizer.DETECTED_LANGUAGE));
    }

    @Test
    public void paragraphsAreSegmented() {
        String original = "First paragraph.\n\nSecond one.\n  \nThird.";
        ProcessedDocument doc = normalizer.normalize(original, List.of(NormalizationStep.SEGMENT_TEXT), Map.of());

        assertEquals(3, doc.segments().size());
        assertEquals("3", doc.metadata().get(TextNormalizer.SEGMENT_COUNT));
        TextSegment second = doc.segments().get(1);
        assertEquals("Second one.", second.text());
        assertEquals("Second one.", original.substring(second.original().start(), second.original().end()));
    }

    @Test
    public void defaultStepsKeepCleanTextUntouched() {
        String original = "Contact John Smith at john.smith@company.com";
        ProcessedDocument doc = normalizer.normalize(original, List.of(), Map.of());

        assertEquals(original, doc.processedText());
        assertEquals(new Range(8, 18), doc.mapRange(8, 18));
    }

    @Test
    public void emptyTextIsReturnedAsIs() {
        ProcessedDocument doc = normalizer.normalize("", null, null);
        assertEquals("", doc.processedText());
        assertTrue(doc.segments().isEmpty());
    }
}
