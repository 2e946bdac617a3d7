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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IBANs written with spaces/dashes and in mixed case. Anchors on country code + check digits, then grows
 * the window char by char and stops at the first end that passes length and MOD-97.
 */
public final class IbanDetector implements Detector {
    public static final String NAME = "iban";
    private static final double CONFIDENCE = 0.9;

    private static final Pattern START = Pattern.compile("(?i)(?<![A-Z0-9])([A-Z]{2}\\d{2})");

    private static final String LENGTHS =
            "AL28 AD24 AT20 AZ28 BA20 BE16 BG22 BH22 BR29 CH21 CR22 CY28 CZ24 DE22 DK18 DO28 EE20 ES24 FI18 "
                    + "FO18 FR27 GB22 GE22 GI23 GL18 GR27 GT28 HR21 HU28 IE22 IL23 IQ23 IS26 IT27 JO30 KW30 KZ20 "
                    + "LB28 LC32 LI21 LT20 LU20 LV21 MC27 MD24 ME22 MK19 MR27 MT31 MU30 NL18 NO15 PK24 PL28 PS29 "
                    + "PT25 QA29 RO24 RS22 SA24 SC31 SE24 SI19 SK24 SM27 TL23 TN24 TR26 UA29 VG24 XK20";

    private static final Map<String, Integer> COUNTRY_LENGTH;

    static {
        Map<String, Integer> m = new HashMap<>();
        for (String entry : LENGTHS.split(" ")) {
            m.put(entry.substring(0, 2), Integer.parseInt(entry.substring(2)));
        }
        COUNTRY_LENGTH = Collections.unmodifiableMap(m);
    }

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
        return Set.of(EntityType.IBAN);
    }

    @Override
    public List<Candidate> detect(String s, DetectionOptions options) {
        if (s == null || s.isEmpty()) return List.of();
        if (options != null && !options.wants(EntityType.IBAN)) return List.of();
        List<Candidate> out = new ArrayList<>();
        Matcher m = START.matcher(s);
        int from = 0;
        while (from < s.length() && m.find(from)) {
            int start = m.start(1);
            int end = grow(s, start, m.end(1));
            if (end > 0) {
                out.add(Candidate.of(EntityType.IBAN, s.substring(start, end), start, end, CONFIDENCE, NAME)
                        .withAttribute("country", s.substring(start, start + 2).toUpperCase(Locale.ROOT)));
                from = end;
            } else {
                from = m.end(1);
            }
        }
        return out;
    }

    /** Returns the exclusive end of the shortest valid IBAN starting at {@code start}, or -1. */
    private static int grow(String s, int start, int seedEnd) {
        StringBuilder norm = new StringBuilder(40);
        norm.append(s, start, seedEnd);
        int i = seedEnd;
        while (i < s.length() && isIbanChar(s.charAt(i))) {
            char ch = s.charAt(i);
            if (ch != '-' && !Character.isWhitespace(ch)) norm.append(Character.toUpperCase(ch));
            int len = norm.length();
            if (len > 34) break;
            if (len >= 15 && isValid(norm)) return i + 1;
            i++;
        }
        return -1;
    }

    private static boolean isIbanChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '-' || ch == ' ';
    }

    /** Length (per known country) and ISO 13616 MOD-97 check on a compact, separator-free value. */
    public static boolean isValid(CharSequence iban) {
        if (iban == null || iban.length() < 15 || iban.length() > 34) return false;
        char c0 = Character.toUpperCase(iban.charAt(0));
        char c1 = Character.toUpperCase(iban.charAt(1));
        if (c0 < 'A' || c0 > 'Z' || c1 < 'A' || c1 > 'Z') return false;
        Integer expected = COUNTRY_LENGTH.get("" + c0 + c1);
        if (expected != null && iban.length() != expected) return false;
        return mod97(iban) == 1;
    }

    /** Convenience overload accepting spaces and dashes. */
    public static boolean isValidFormatted(String raw) {
        if (raw == null) return false;
        return isValid(raw.replaceAll("[\\s-]+", "").toUpperCase(Locale.ROOT));
    }

    private static int mod97(CharSequence iban) {
        StringBuilder sb = new StringBuilder(iban.length());
        sb.append(iban, 4, iban.length()).append(iban, 0, 4);
        int rem = 0;
        for (int k = 0; k < sb.length(); k++) {
            char ch = Character.toUpperCase(sb.charAt(k));
            if (ch >= '0' && ch <= '9') {
                rem = (rem * 10 + (ch - '0')) % 97;
            } else if (ch >= 'A' && ch <= 'Z') {
                int v = ch - 'A' + 10;
                rem = (rem * 100 + v) % 97;
            } else {
                return -1;
            }
        }
        return rem;
    }
}
