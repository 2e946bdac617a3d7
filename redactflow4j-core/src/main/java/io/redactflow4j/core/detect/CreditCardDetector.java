/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Bare card numbers: 13–19 digits (with optional spaces/dashes), validated via Luhn. */
public final class CreditCardDetector implements Detector {
    public static final String NAME = "credit_card";
    public static final String BRAND_ATTRIBUTE = "card_brand";

    private static final double CONFIDENCE = 0.95;
    private static final Pattern DIGITS = Pattern.compile("(?<!\\d)(\\d[\\d -]{11,22}\\d)(?!\\d)");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.PATTERN;
    }

    @Override
    public Set<EntityType> supportedTypes() {
        return Set.of(EntityType.CREDIT_CARD);
    }

    @Override
    public List<Candidate> detect(String s, DetectionOptions options) {
        if (s == null || s.isEmpty()) return List.of();
        if (options != null && !options.wants(EntityType.CREDIT_CARD)) return List.of();
        List<Candidate> out = new ArrayList<>();
        Matcher m = DIGITS.matcher(s);
        while (m.find()) {
            String raw = digitsOnly(m.group(1));
            if (raw.length() >= 13 && raw.length() <= 19 && luhn(raw)) {
                out.add(Candidate.of(EntityType.CREDIT_CARD, m.group(1), m.start(1), m.end(1), CONFIDENCE, NAME)
                        .withAttribute(BRAND_ATTRIBUTE, brand(raw)));
            }
        }
        return out;
    }

    /** Luhn check over a digits-only string; false for anything else. */
    public static boolean luhn(String s) {
        if (s == null || s.isEmpty()) return false;
        int sum = 0;
        boolean dbl = false;
        for (int i = s.length() - 1; i >= 0; i--) {
            int d = s.charAt(i) - '0';
            if (d < 0 || d > 9) return false;
            if (dbl) {
                d += d;
                if (d > 9) d -= 9;
            }
            sum += d;
            dbl = !dbl;
        }
        return sum % 10 == 0;
    }

    /** ASCII digits of {@code s}, separators dropped. */
    public static String digitsOnly(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    static String brand(String digits) {
        if (digits.startsWith("4")) return "visa";
        if (digits.startsWith("34") || digits.startsWith("37")) return "amex";
        if (digits.startsWith("6011") || digits.startsWith("65")) return "discover";
        int two = Integer.parseInt(digits.substring(0, 2));
        if (two >= 51 && two <= 55) return "mastercard";
        int four = Integer.parseInt(digits.substring(0, 4));
        if (four >= 2221 && four <= 2720) return "mastercard";
        return "unknown";
    }
}
