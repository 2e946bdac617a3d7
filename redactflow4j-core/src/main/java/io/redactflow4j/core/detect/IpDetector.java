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

/** IPv4 (every octet 0-255) and IPv6 in full or {@code ::}-compressed form. */
public final class IpDetector implements Detector {
    public static final String NAME = "ip";
    public static final String VERSION_ATTRIBUTE = "ip_version";

    private static final double CONFIDENCE = 0.9;
    private static final Pattern IPV4 = Pattern.compile("(?<![\\d.])(?:\\d{1,3}\\.){3}\\d{1,3}(?![\\d]|\\.\\d)");
    private static final Pattern IPV6 = Pattern.compile(
            "(?<![0-9A-Fa-f:])(?:(?:[0-9A-Fa-f]{1,4}:){7}[0-9A-Fa-f]{1,4}"
                    + "|(?:[0-9A-Fa-f]{1,4}:){1,7}:(?:[0-9A-Fa-f]{1,4}(?::[0-9A-Fa-f]{1,4}){0,5})?)"
                    + "(?![0-9A-Fa-f:])");

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
        return Set.of(EntityType.IP_ADDRESS);
    }

    @Override
    public List<Candidate> detect(String s, DetectionOptions options) {
        if (s == null || s.isEmpty()) return List.of();
        if (options != null && !options.wants(EntityType.IP_ADDRESS)) return List.of();
        List<Candidate> out = new ArrayList<>();
        Matcher a = IPV4.matcher(s);
        while (a.find()) {
            if (!isValidIpv4(a.group())) continue;
            out.add(candidate(a, "4"));
        }
        Matcher b = IPV6.matcher(s);
        while (b.find()) {
            out.add(candidate(b, "6"));
        }
        return out;
    }

    private static Candidate candidate(Matcher m, String version) {
        return Candidate.of(EntityType.IP_ADDRESS, m.group(), m.start(), m.end(), CONFIDENCE, NAME)
                .withAttribute(VERSION_ATTRIBUTE, version);
    }

    /** Dotted quad with four octets in 0..255. */
    public static boolean isValidIpv4(String s) {
        if (s == null) return false;
        String[] parts = s.split("\\.", -1);
        if (parts.length != 4) return false;
        for (String p : parts) {
            if (p.isEmpty() || p.length() > 3) return false;
            for (int i = 0; i < p.length(); i++) {
                if (!Character.isDigit(p.charAt(i))) return false;
            }
            if (Integer.parseInt(p) > 255) return false;
        }
        return true;
    }

    /** Loose IPv6 shape check: hex groups separated by colons, at most one {@code ::}. */
    public static boolean isValidIpv6(String s) {
        if (s == null || !s.contains(":")) return false;
        if (s.indexOf("::") != s.lastIndexOf("::")) return false;
        String[] groups = s.split(":", -1);
        if (groups.length > 8 || (groups.length < 8 && !s.contains("::"))) return false;
        for (String g : groups) {
            if (g.length() > 4) return false;
            for (int i = 0; i < g.length(); i++) {
                if (Character.digit(g.charAt(i), 16) < 0) return false;
            }
        }
        return true;
    }
}
