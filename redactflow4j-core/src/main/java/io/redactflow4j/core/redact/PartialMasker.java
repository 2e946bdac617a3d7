/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.EntityType;
import java.util.EnumMap;
import java.util.Map;

/**
 * Type-specific partial masks. Types without a rule fall back to "first and last char visible".
 * A rule that cannot apply to the value at hand (too few digits, no {@code @}) also falls back.
 */
final class PartialMasker {
    static final int VISIBLE_TAIL = 4;

    @FunctionalInterface
    interface Rule {
        /** @return the masked value, or null when the rule does not fit this value */
        String apply(String value, char mask, boolean preserveFormat);
    }

    private final Map<EntityType, Rule> rules = new EnumMap<>(EntityType.class);

    PartialMasker() {
        Rule lastFour = PartialMasker::lastFourDigits;
        Rule lastGroup = PartialMasker::lastGroup;
        rules.put(EntityType.CREDIT_CARD, lastFour);
        rules.put(EntityType.PHONE, lastFour);
        rules.put(EntityType.SSN, lastGroup);
        rules.put(EntityType.TAX_ID, lastGroup);
        rules.put(EntityType.IBAN, lastGroup);
        rules.put(EntityType.BANK_ACCOUNT, lastGroup);
        rules.put(EntityType.EMAIL, PartialMasker::email);
        rules.put(EntityType.PERSON, PartialMasker::initials);
    }

    String mask(EntityType type, String value, char mask, boolean preserveFormat) {
        Rule rule = rules.get(type);
        if (rule != null) {
            String out = rule.apply(value, mask, preserveFormat);
            if (out != null) return out;
        }
        return firstAndLast(value, mask);
    }

    /** {@code 4111-1111-1111-1111 -> XXXX-XXXX-XXXX-1111}; separators kept when formatting is preserved. */
    static String lastFourDigits(String value, char mask, boolean preserveFormat) {
        int digits = countDigits(value);
        if (digits <= VISIBLE_TAIL) return null;
        int hidden = digits - VISIBLE_TAIL;
        StringBuilder sb = new StringBuilder(value.length());
        int seen = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isDigit(c)) {
                sb.append(seen < hidden ? mask : c);
                seen++;
            } else if (preserveFormat) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Masks every separator-delimited group but the last, which stays visible up to four chars:
     * {@code 123-45-6789 -> XXX-XX-6789}, or {@code XXXXX6789} without format.
     */
    static String lastGroup(String value, char mask, boolean preserveFormat) {
        int end = value.length();
        while (end > 0 && !Character.isLetterOrDigit(value.charAt(end - 1))) end--;
        int start = end;
        while (start > 0 && Character.isLetterOrDigit(value.charAt(start - 1))) start--;
        int groupLen = end - start;
        int alnum = countAlnum(value);
        if (groupLen == 0 || alnum <= VISIBLE_TAIL) return null;
        int visible = Math.min(VISIBLE_TAIL, groupLen);
        if (groupLen == alnum) visible = Math.min(visible, alnum - 1);
        int revealFrom = end - visible;

        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(i >= revealFrom && i < end ? c : mask);
            } else if (preserveFormat) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** {@code john.smith@company.com -> jXXXXXXXXX@company.com}. */
    static String email(String value, char mask, boolean preserveFormat) {
        int at = value.indexOf('@');
        if (at < 2) return null;
        return value.charAt(0) + String.valueOf(mask).repeat(at - 1) + value.substring(at);
    }

    /** {@code John Smith -> JXXX SXXXX}; single-letter tokens are left alone. */
    static String initials(String value, char mask, boolean preserveFormat) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length < 2) return null;
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(' ');
            String p = parts[i];
            sb.append(p.charAt(0));
            if (p.length() > 1) sb.append(String.valueOf(mask).repeat(p.length() - 1));
        }
        return sb.toString();
    }

    static String firstAndLast(String value, char mask) {
        int n = value.length();
        if (n > 2) return value.charAt(0) + String.valueOf(mask).repeat(n - 2) + value.charAt(n - 1);
        if (n == 2) return value.charAt(0) + String.valueOf(mask);
        return String.valueOf(mask).repeat(n);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int countDigits(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (isDigit(s.charAt(i))) n++;
        return n;
    }

    private static int countAlnum(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (Character.isLetterOrDigit(s.charAt(i))) n++;
        return n;
    }
}
