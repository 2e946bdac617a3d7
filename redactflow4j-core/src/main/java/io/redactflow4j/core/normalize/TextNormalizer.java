/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.Range;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link NormalizationStep}s in order while keeping every processed char traceable to the original
 * text.
 *
 * <h3>Step contracts</h3>
 * <ul>
 *   <li><b>remove_control_chars</b>: drops Unicode category C code points except space, tab, LF and CR.</li>
 *   <li><b>normalize_whitespace</b>: collapses runs of spaces/tabs to one space; line breaks are left
 *       alone so paragraph breaks survive.</li>
 *   <li><b>normalize_unicode</b>: NFKC. When the length changes, the common prefix and suffix keep their
 *       exact mapping and the changed middle gets a proportional, approximate one.</li>
 *   <li><b>detect_language</b>: best-effort, never fatal.</li>
 *   <li><b>segment_text</b>: paragraph spans over the processed text.</li>
 * </ul>
 *
 * A failing step is skipped with a warning; {@link #normalize} itself never throws for non-null input.
 */
public final class TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    public static final String REMOVED_CONTROL_CHARS = "removed_control_chars";
    public static final String COLLAPSED_WHITESPACE = "collapsed_whitespace";
    public static final String UNICODE_NORMALIZED = "unicode_normalized";
    public static final String DETECTED_LANGUAGE = "detected_language";
    public static final String LANGUAGE_DETECTION_ERROR = "language_detection_error";
    public static final String SEGMENT_COUNT = "segment_count";
    public static final String SKIPPED_STEPS = "skipped_steps";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");

    private final LanguageGuesser languageGuesser;

    public TextNormalizer() {
        this(new LanguageGuesser());
    }

    public TextNormalizer(LanguageGuesser languageGuesser) {
        this.languageGuesser = Objects.requireNonNull(languageGuesser, "languageGuesser");
    }

    public ProcessedDocument normalize(String text, List<NormalizationStep> steps, Map<String, String> metadata) {
        ProcessedDocument doc = ProcessedDocument.of(Objects.requireNonNull(text, "text"), metadata);
        if (text.isEmpty()) return doc;

        List<NormalizationStep> effective = (steps == null || steps.isEmpty()) ? NormalizationStep.defaults() : steps;
        List<String> skipped = new ArrayList<>();
        for (NormalizationStep step : effective) {
            try {
                doc = apply(step, doc);
            } catch (RuntimeException e) {
                log.warn("Normalization step '{}' failed, skipping: {}", step.id(), e.toString());
                skipped.add(step.id());
            }
        }
        if (!skipped.isEmpty()) doc = doc.withMetadata(SKIPPED_STEPS, String.join(",", skipped));
        return doc;
    }

    ProcessedDocument apply(NormalizationStep step, ProcessedDocument doc) {
        return switch (step) {
            case REMOVE_CONTROL_CHARS -> removeControlChars(doc);
            case NORMALIZE_WHITESPACE -> normalizeWhitespace(doc);
            case NORMALIZE_UNICODE -> normalizeUnicode(doc);
            case DETECT_LANGUAGE -> detectLanguage(doc);
            case SEGMENT_TEXT -> segment(doc);
        };
    }

    private static ProcessedDocument removeControlChars(ProcessedDocument doc) {
        String text = doc.processedText();
        StringBuilder out = new StringBuilder(text.length());
        int[] idx = new int[text.length()];
        int removed = 0;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int n = Character.charCount(cp);
            if (isRemovableControl(cp)) {
                removed++;
            } else {
                for (int k = 0; k < n; k++) {
                    idx[out.length()] = i + k;
                    out.append(text.charAt(i + k));
                }
            }
            i += n;
        }
        if (removed == 0) return doc.withMetadata(REMOVED_CONTROL_CHARS, "0");
        return doc.transform(out.toString(), trim(idx, out.length()), new BitSet())
                .withMetadata(REMOVED_CONTROL_CHARS, Integer.toString(removed));
    }

    static boolean isRemovableControl(int cp) {
        if (cp == ' ' || cp == '\t' || cp == '\n' || cp == '\r') return false;
        int type = Character.getType(cp);
        return type == Character.CONTROL
                || type == Character.FORMAT
                || type == Character.PRIVATE_USE
                || type == Character.SURROGATE
                || type == Character.UNASSIGNED;
    }

    private static ProcessedDocument normalizeWhitespace(ProcessedDocument doc) {
        String text = doc.processedText();
        StringBuilder out = new StringBuilder(text.length());
        int[] idx = new int[text.length()];
        int collapsed = 0;
        boolean changed = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\t') {
                boolean tab = c == '\t';
                int j = i + 1;
                while (j < text.length() && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) {
                    tab |= text.charAt(j) == '\t';
                    j++;
                }
                idx[out.length()] = i;
                out.append(' ');
                collapsed += j - i - 1;
                changed |= tab || j - i > 1;
                i = j;
            } else {
                idx[out.length()] = i;
                out.append(c);
                i++;
            }
        }
        if (!changed) return doc;
        return doc.transform(out.toString(), trim(idx, out.length()), new BitSet())
                .withMetadata(COLLAPSED_WHITESPACE, Integer.toString(collapsed));
    }

    private static ProcessedDocument normalizeUnicode(ProcessedDocument doc) {
        String before = doc.processedText();
        String after = Normalizer.normalize(before, Normalizer.Form.NFKC);
        if (after.equals(before)) return doc;

        int[] idx = new int[after.length()];
        BitSet approx = new BitSet(after.length());
        if (after.length() == before.length()) {
            for (int i = 0; i < idx.length; i++) idx[i] = i;
        } else {
            int prefix = commonPrefix(before, after);
            int suffix = commonSuffix(before, after, prefix);
            int beforeMid = before.length() - prefix - suffix;
            int afterMid = after.length() - prefix - suffix;
            for (int i = 0; i < prefix; i++) idx[i] = i;
            for (int i = 0; i < afterMid; i++) {
                int pos = prefix + i;
                idx[pos] = beforeMid == 0
                        ? Math.min(prefix, before.length() - 1)
                        : prefix + (int) ((long) i * beforeMid / afterMid);
                approx.set(pos);
            }
            for (int i = 0; i < suffix; i++) {
                idx[after.length() - suffix + i] = before.length() - suffix + i;
            }
        }
        return doc.transform(after, idx, approx).withMetadata(UNICODE_NORMALIZED, "true");
    }

    private ProcessedDocument detectLanguage(ProcessedDocument doc) {
        try {
            return languageGuesser
                    .guess(doc.processedText())
                    .map(lang -> doc.withMetadata(DETECTED_LANGUAGE, lang))
                    .orElse(doc);
        } catch (RuntimeException e) {
            log.warn("Language detection failed: {}", e.toString());
            return doc.withMetadata(LANGUAGE_DETECTION_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private static ProcessedDocument segment(ProcessedDocument doc) {
        String text = doc.processedText();
        List<TextSegment> segments = new ArrayList<>();
        Matcher m = PARAGRAPH_BREAK.matcher(text);
        int pos = 0;
        while (m.find()) {
            addSegment(doc, text, pos, m.start(), segments);
            pos = m.end();
        }
        addSegment(doc, text, pos, text.length(), segments);
        return doc.withSegments(segments).withMetadata(SEGMENT_COUNT, Integer.toString(segments.size()));
    }

    private static void addSegment(ProcessedDocument doc, String text, int start, int end, List<TextSegment> out) {
        if (start >= end || text.substring(start, end).isBlank()) return;
        Range original = doc.mapRange(start, end);
        if (original.isUnmappable()) original = doc.estimateRange(start, end);
        out.add(new TextSegment(text.substring(start, end), start, end, original, "paragraph"));
    }

    private static int commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) i++;
        // never split a surrogate pair or strand a combining mark on the exact side
        while (i > 0 && (Character.isHighSurrogate(a.charAt(i - 1)) || (i < b.length() && isCombining(b.charAt(i)))))
            i--;
        return i;
    }

    private static int commonSuffix(String a, String b, int prefix) {
        int max = Math.min(a.length(), b.length()) - prefix;
        int s = 0;
        while (s < max && a.charAt(a.length() - 1 - s) == b.charAt(b.length() - 1 - s)) s++;
        while (s > 0 && (Character.isLowSurrogate(a.charAt(a.length() - s)) || isCombining(a.charAt(a.length() - s))))
            s--;
        return s;
    }

    private static boolean isCombining(char c) {
        int t = Character.getType(c);
        return t == Character.NON_SPACING_MARK || t == Character.COMBINING_SPACING_MARK || t == Character.ENCLOSING_MARK;
    }

    private static int[] trim(int[] idx, int length) {
        if (idx.length == length) return idx;
        int[] out = new int[length];
        System.arraycopy(idx, 0, out, 0, length);
        return out;
    }
}
