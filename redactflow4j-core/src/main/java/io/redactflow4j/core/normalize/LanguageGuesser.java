/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;

/**
 * Tags the dominant language of a text with Tika's Optimaize n-gram detector, looking at the leading
 * {@value #MAX_SAMPLE} chars only. Models load on first use.
 */
public class LanguageGuesser {
    static final int MIN_LENGTH = 10;
    static final int MAX_SAMPLE = 4000;

    // guarded by this; the detector buffers text between calls
    private LanguageDetector detector;

    /**
     * @return an ISO 639-1 code, or empty when the text is too short or no language is recognized
     * @throws UncheckedIOException when the language models cannot be loaded
     */
    public synchronized Optional<String> guess(String text) {
        if (text == null || text.length() < MIN_LENGTH) return Optional.empty();
        String sample = text.length() > MAX_SAMPLE ? text.substring(0, MAX_SAMPLE) : text;

        LanguageResult result = detector().detect(sample);
        if (result.isUnknown() || result.getLanguage().isEmpty()) return Optional.empty();
        return Optional.of(result.getLanguage());
    }

    private LanguageDetector detector() {
        if (detector == null) {
            try {
                LanguageDetector optimaize = new OptimaizeLangDetector();
                detector = optimaize.loadModels();
            } catch (IOException e) {
                throw new UncheckedIOException("Language models failed to load", e);
            }
        }
        return detector;
    }
}
