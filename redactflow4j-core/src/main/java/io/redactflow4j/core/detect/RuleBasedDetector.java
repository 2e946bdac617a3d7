/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static io.redactflow4j.core.api.model.EntityType.*;

import io.redactflow4j.core.api.DetectorKind;
import java.util.List;
import java.util.regex.Pattern;

/**
 * General-purpose regex detector for contact data, government ids, dates and locations.
 * Cards, IBANs and IP addresses have dedicated checksum-aware detectors and are not covered here.
 */
public final class RuleBasedDetector extends RegexDetector {
    public static final String NAME = "rule_based";

    private static final String MONTH = "(?:0?[1-9]|1[0-2])";
    private static final String DAY = "(?:0?[1-9]|[12][0-9]|3[01])";
    private static final String YEAR = "(?:19|20)\\d{2}";
    private static final String SEP = "[/.-]";

    public RuleBasedDetector() {
        super(NAME, DetectorKind.PATTERN, defaultRules());
    }

    static List<PatternRule> defaultRules() {
        return List.of(
                PatternRule.of("email", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", EMAIL, 0.95),
                PatternRule.of("phone_dashed", "\\b\\d{3}-\\d{3}-\\d{4}\\b", PHONE, 0.85),
                PatternRule.of("phone_parens", "(?<![\\w)])\\(\\d{3}\\)\\s?\\d{3}-\\d{4}\\b", PHONE, 0.85),
                PatternRule.of("phone_dotted", "\\b\\d{3}\\.\\d{3}\\.\\d{4}\\b", PHONE, 0.85),
                PatternRule.of("phone_intl_us", "(?<![\\w+])\\+1[-.\\s]?\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b", PHONE, 0.85),
                PatternRule.of("phone_compact", "(?<![\\d-])\\b\\d{10}\\b(?!-\\d)", PHONE, 0.6),
                PatternRule.of("ssn_dashed", "\\b\\d{3}-\\d{2}-\\d{4}\\b", SSN, 0.95)
                        .accepting(RuleBasedDetector::isPlausibleSsn),
                PatternRule.of("ssn_spaced", "\\b\\d{3} \\d{2} \\d{4}\\b", SSN, 0.9)
                        .accepting(RuleBasedDetector::isPlausibleSsn),
                PatternRule.of("ssn_keyed", "\\bSSN:?\\s*(?<val>\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{4})\\b",
                                Pattern.CASE_INSENSITIVE, SSN, 0.95)
                        .accepting(RuleBasedDetector::isPlausibleSsn),
                PatternRule.of("pan", "\\b[A-Z]{5}\\d{4}[A-Z]\\b", PAN, 0.9),
                PatternRule.of("url", "\\bhttps?://[^\\s<>\"']*[^\\s<>\"'.,;:!?)\\]]", URL, 0.85),
                PatternRule.of(
                        "address_street",
                        "\\b\\d{1,6}\\s+(?:[A-Z][A-Za-z]*\\s+){1,4}"
                                + "(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr)\\b\\.?",
                        ADDRESS,
                        0.7),
                PatternRule.of(
                        "address_city_state_zip",
                        "\\b\\d{1,6}\\s+[A-Za-z ]{2,40},\\s*[A-Za-z ]{2,30},\\s*[A-Z]{2}\\s*\\d{5}(?:-\\d{4})?\\b",
                        ADDRESS,
                        0.75),
                PatternRule.of("date_mdy", "\\b" + MONTH + SEP + DAY + SEP + YEAR + "\\b", DATE, 0.85),
                PatternRule.of("date_dmy", "\\b" + DAY + SEP + MONTH + SEP + YEAR + "\\b", DATE, 0.85),
                PatternRule.of("date_ymd", "\\b" + YEAR + SEP + MONTH + SEP + DAY + "\\b", DATE, 0.85),
                PatternRule.of(
                        "dob_keyed",
                        "\\b(?:DOB|D\\.O\\.B\\.|Date\\s+of\\s+Birth)[:;\\s]+(?<val>(?:" + MONTH + SEP + DAY + "|" + DAY
                                + SEP + MONTH + ")" + SEP + YEAR + ")\\b",
                        Pattern.CASE_INSENSITIVE,
                        DATE_OF_BIRTH,
                        0.95),
                PatternRule.of("passport_us", "\\b[A-Z][0-9]{8}\\b", PASSPORT, 0.9),
                PatternRule.of("drivers_license", "\\b[A-Z][0-9]{7}\\b", DRIVERS_LICENSE, 0.85),
                PatternRule.of(
                        "gps",
                        "(?<![\\d.])[-+]?(?:90(?:\\.0+)|[1-8]?\\d\\.\\d+),\\s*[-+]?(?:180(?:\\.0+)|(?:1[0-7]\\d|[1-9]?\\d)\\.\\d+)(?![\\d.])",
                        GPS_COORDINATES,
                        0.9));
    }

    /**
     * Nine digits (separators ignored) outside the never-issued ranges: area 000, 666 or 9xx, group 00,
     * serial 0000.
     */
    public static boolean isPlausibleSsn(String value) {
        if (value == null) return false;
        String d = CreditCardDetector.digitsOnly(value);
        if (d.length() != 9) return false;
        String area = d.substring(0, 3);
        if (area.equals("000") || area.equals("666") || area.charAt(0) == '9') return false;
        if (d.substring(3, 5).equals("00")) return false;
        return !d.substring(5).equals("0000");
    }
}
