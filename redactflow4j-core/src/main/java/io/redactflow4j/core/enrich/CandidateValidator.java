/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.enrich;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.Context;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.Validation;
import io.redactflow4j.core.api.model.ValidationStatus;
import io.redactflow4j.core.detect.CreditCardDetector;
import io.redactflow4j.core.detect.FinancialDetector;
import io.redactflow4j.core.detect.IbanDetector;
import io.redactflow4j.core.detect.IpDetector;
import io.redactflow4j.core.detect.RuleBasedDetector;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Structural and contextual checks. Every check is tri-state; a check that cannot judge the candidate
 * reports {@link ValidationStatus#NOT_APPLICABLE}.
 */
public final class CandidateValidator {
    static final int MIN_LENGTH = 1;
    static final int MAX_LENGTH = 100;

    static final Set<String> SUSPICIOUS_CONTEXT = Set.of("not", "fake", "example", "test", "dummy", "sample");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "from",
            "up", "about", "into", "over", "after", "is", "are", "was", "were", "be", "been", "this", "that",
            "these", "those", "it", "he", "she", "they", "we", "you", "i", "me", "my", "our", "your", "his",
            "her", "their", "dear", "hello", "hi", "thanks", "regards", "mr", "mrs", "ms", "dr");

    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final Pattern EMAIL_SHAPE =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("M/d/uuuu"), strict("M-d-uuuu"), strict("M.d.uuuu"),
            strict("d/M/uuuu"), strict("d-M-uuuu"), strict("d.M.uuuu"),
            strict("uuuu/M/d"), strict("uuuu-M-d"), strict("uuuu.M.d"));

    /** Card-adjacent values the financial detector types as credit_card but which are not card numbers. */
    private static final Set<String> CARD_SIDE_VALUES = Set.of("cvv", "expiration_date");

    private final Map<EntityType, Predicate<String>> formatChecks;

    public CandidateValidator() {
        Map<EntityType, Predicate<String>> m = new EnumMap<>(EntityType.class);
        m.put(EntityType.EMAIL, CandidateValidator::isEmail);
        m.put(EntityType.PHONE, CandidateValidator::isPhone);
        m.put(EntityType.SSN, RuleBasedDetector::isPlausibleSsn);
        m.put(EntityType.CREDIT_CARD, CandidateValidator::isCardNumber);
        m.put(EntityType.IBAN, IbanDetector::isValidFormatted);
        m.put(EntityType.IP_ADDRESS, v -> IpDetector.isValidIpv4(v) || IpDetector.isValidIpv6(v));
        m.put(EntityType.DATE, CandidateValidator::isDate);
        m.put(EntityType.DATE_OF_BIRTH, CandidateValidator::isDate);
        this.formatChecks = m;
    }

    public Validation validate(Candidate candidate, Context context) {
        Map<String, ValidationStatus> checks = new LinkedHashMap<>();
        checks.put(Validation.FORMAT_VALID, format(candidate));
        checks.put(Validation.CONTEXT_APPROPRIATE, contextAppropriate(context));
        checks.put(Validation.NOT_COMMON_WORD, notCommonWord(candidate));
        checks.put(Validation.LENGTH_APPROPRIATE, length(candidate.text()));
        return new Validation(checks);
    }

    ValidationStatus format(Candidate c) {
        if (c.type() == EntityType.CREDIT_CARD
                && CARD_SIDE_VALUES.contains(c.attributes().get(FinancialDetector.SUBTYPE_ATTRIBUTE))) {
            return ValidationStatus.NOT_APPLICABLE;
        }
        Predicate<String> check = formatChecks.get(c.type());
        if (check == null) return ValidationStatus.NOT_APPLICABLE;
        return ValidationStatus.of(check.test(c.text().trim()));
    }

    static ValidationStatus contextAppropriate(Context context) {
        if (context == null) return ValidationStatus.NOT_APPLICABLE;
        boolean suspicious = containsWord(context.before()) || containsWord(context.after());
        return ValidationStatus.of(!suspicious);
    }

    private static boolean containsWord(String s) {
        if (s == null || s.isEmpty()) return false;
        var m = WORD.matcher(s);
        while (m.find()) {
            if (SUSPICIOUS_CONTEXT.contains(m.group().toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    static ValidationStatus notCommonWord(Candidate c) {
        if (c.type() != EntityType.PERSON) return ValidationStatus.NOT_APPLICABLE;
        var m = WORD.matcher(c.text());
        boolean any = false;
        while (m.find()) {
            any = true;
            if (!STOP_WORDS.contains(m.group().toLowerCase(Locale.ROOT))) return ValidationStatus.PASS;
        }
        return any ? ValidationStatus.FAIL : ValidationStatus.NOT_APPLICABLE;
    }

    static ValidationStatus length(String text) {
        int n = text.trim().length();
        return ValidationStatus.of(n >= MIN_LENGTH && n <= MAX_LENGTH);
    }

    static boolean isEmail(String v) {
        if (!EMAIL_SHAPE.matcher(v).matches()) return false;
        int at = v.indexOf('@');
        String domain = v.substring(at + 1);
        return !v.contains("..") && !domain.startsWith("-") && !domain.startsWith(".") && at <= 64;
    }

    static boolean isPhone(String v) {
        int digits = CreditCardDetector.digitsOnly(v).length();
        return digits >= 7 && digits <= 15;
    }

    static boolean isCardNumber(String v) {
        String d = CreditCardDetector.digitsOnly(v);
        return d.length() >= 13 && d.length() <= 19 && CreditCardDetector.luhn(d);
    }

    static boolean isDate(String v) {
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                LocalDate.parse(v, f);
                return true;
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return false;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
