/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static io.redactflow4j.core.api.model.EntityType.*;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.detect.EntityDefinition.Sensitivity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects entities from an in-memory knowledge base of {@link EntityDefinition}s.
 *
 * <p>Only definitions relevant to the text take part: those whose name, description or keywords share a
 * word with the text, and those with a pattern that matches it. A relevant definition contributes
 * <ul>
 *   <li>its pattern matches, scored {@value #BASE_CONFIDENCE} plus the sensitivity boost, plus
 *       {@value #CONTEXT_BOOST} when a context keyword sits within {@value #CONTEXT_WINDOW} chars, plus
 *       {@value #EXAMPLE_BOOST} for an exact example, capped at 1.0;</li>
 *   <li>for person, organization and location definitions, capitalized phrases near a context keyword at
 *       {@value #CONTEXT_CONFIDENCE}, reported under source {@code knowledge_base_context}.</li>
 * </ul>
 *
 * Definitions can be added and replaced while the pipeline is serving.
 */
public final class KnowledgeBaseDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseDetector.class);

    public static final String NAME = "knowledge_base";
    public static final String CONTEXT_SOURCE = NAME + "_context";

    public static final String DEFINITION_ATTRIBUTE = "kb_definition";
    public static final String SENSITIVITY_ATTRIBUTE = "sensitivity_level";
    public static final String CONTEXT_MATCH_ATTRIBUTE = "context_match";
    public static final String METHOD_ATTRIBUTE = "detection_method";

    static final double BASE_CONFIDENCE = 0.7;
    static final double CONTEXT_BOOST = 0.15;
    static final double EXAMPLE_BOOST = 0.1;
    static final double CONTEXT_CONFIDENCE = 0.6;
    static final int CONTEXT_WINDOW = 50;
    private static final int QUERY_TERMS = 10;

    private static final Pattern WORD = Pattern.compile("\\w+");
    private static final Pattern PERSON_PHRASE = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b");
    private static final Pattern ORGANIZATION_PHRASE =
            Pattern.compile("\\b[A-Z][a-zA-Z&.-]*(?:\\s+(?:&\\s+)?[A-Z][a-zA-Z&.-]*)*\\b");
    private static final Pattern LOCATION_PHRASE = Pattern.compile("\\b[A-Z][a-zA-Z-]*(?:,?\\s+[A-Z][a-zA-Z-]*)*\\b");

    /** A definition with its patterns compiled once. */
    private record Entry(EntityDefinition definition, List<Pattern> patterns, Set<String> terms) {}

    private final CopyOnWriteArrayList<Entry> entries = new CopyOnWriteArrayList<>();

    public KnowledgeBaseDetector() {
        this(defaultDefinitions());
    }

    public KnowledgeBaseDetector(List<EntityDefinition> definitions) {
        for (EntityDefinition d : definitions) addDefinition(d);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.DOMAIN;
    }

    @Override
    public Set<EntityType> supportedTypes() {
        EnumSet<EntityType> types = EnumSet.noneOf(EntityType.class);
        for (Entry e : entries) types.add(e.definition().type());
        return Collections.unmodifiableSet(types);
    }

    @Override
    public List<Candidate> detect(String text, DetectionOptions options) {
        if (text == null || text.isEmpty()) return List.of();
        DetectionOptions opts = options == null ? DetectionOptions.defaults() : options;

        Map<String, Candidate> out = new LinkedHashMap<>();
        for (Entry e : relevant(text)) {
            if (!opts.wants(e.definition().type())) continue;
            try {
                applyPatterns(text, e, out);
                applyContext(text, e, out);
            } catch (RuntimeException ex) {
                log.warn("Knowledge base definition '{}' failed: {}", e.definition().name(), ex.toString());
            }
        }
        return List.copyOf(out.values());
    }

    /**
     * Adds a definition.
     *
     * @return false when a definition with the same type and name already exists
     * @throws IllegalArgumentException if one of its patterns does not compile
     */
    public boolean addDefinition(EntityDefinition definition) {
        Entry entry = compile(definition);
        synchronized (entries) {
            if (entries.stream().anyMatch(e -> e.definition().sameKey(definition))) return false;
            entries.add(entry);
        }
        log.debug("Knowledge base definition '{}' added for type {}", definition.name(), definition.type().id());
        return true;
    }

    /**
     * Replaces the definition with the same type and name.
     *
     * @return false when there was nothing to replace
     * @throws IllegalArgumentException if one of its patterns does not compile
     */
    public boolean updateDefinition(EntityDefinition definition) {
        Entry entry = compile(definition);
        synchronized (entries) {
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).definition().sameKey(definition)) {
                    entries.set(i, entry);
                    log.debug("Knowledge base definition '{}' updated", definition.name());
                    return true;
                }
            }
        }
        return false;
    }

    public boolean removeDefinition(EntityType type, String name) {
        return entries.removeIf(e -> e.definition().type() == type && e.definition().name().equals(name));
    }

    /** First definition for {@code type}, or the one called {@code name} when that is given. */
    public Optional<EntityDefinition> findDefinition(EntityType type, String name) {
        return entries.stream()
                .map(Entry::definition)
                .filter(d -> d.type() == type && (name == null || d.name().equals(name)))
                .findFirst();
    }

    /**
     * Definitions sharing at least one word with {@code query}, best match first. A blank query returns
     * every definition.
     *
     * @param types restricts the result; empty or null means all types
     */
    public List<EntityDefinition> search(String query, Set<EntityType> types) {
        Set<String> terms = query == null ? Set.of() : words(query, 0, Integer.MAX_VALUE);
        List<Entry> candidates = new ArrayList<>();
        for (Entry e : entries) {
            if (types == null || types.isEmpty() || types.contains(e.definition().type())) candidates.add(e);
        }
        if (terms.isEmpty()) return candidates.stream().map(Entry::definition).toList();

        List<Map.Entry<Entry, Long>> scored = new ArrayList<>();
        for (Entry e : candidates) {
            long hits = terms.stream().filter(e.terms()::contains).count();
            if (hits > 0) scored.add(Map.entry(e, hits));
        }
        scored.sort(Map.Entry.<Entry, Long>comparingByValue().reversed());
        return scored.stream().map(s -> s.getKey().definition()).toList();
    }

    public List<EntityDefinition> definitions() {
        return entries.stream().map(Entry::definition).toList();
    }

    private List<Entry> relevant(String text) {
        Set<String> query = words(text, 4, QUERY_TERMS);
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            boolean byTerms = query.stream().anyMatch(e.terms()::contains);
            if (byTerms || e.patterns().stream().anyMatch(p -> p.matcher(text).find())) out.add(e);
        }
        return out;
    }

    private void applyPatterns(String text, Entry e, Map<String, Candidate> out) {
        EntityDefinition def = e.definition();
        for (Pattern p : e.patterns()) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                if (m.start() == m.end()) continue;
                boolean nearKeyword = hasKeywordNear(text, m.start(), m.end(), def);
                double confidence = BASE_CONFIDENCE + def.sensitivity().boost();
                if (nearKeyword) confidence += CONTEXT_BOOST;
                if (isExample(m.group(), def)) confidence += EXAMPLE_BOOST;

                Candidate c = Candidate.of(def.type(), m.group(), m.start(), m.end(), Math.min(confidence, 1.0), NAME)
                        .withAttributes(Map.of(
                                DEFINITION_ATTRIBUTE, def.name(),
                                SENSITIVITY_ATTRIBUTE, def.sensitivity().name().toLowerCase(Locale.ROOT),
                                CONTEXT_MATCH_ATTRIBUTE, Boolean.toString(nearKeyword),
                                PatternRule.PATTERN_NAME_ATTRIBUTE, p.pattern()));
                keepBest(out, c);
            }
        }
    }

    private void applyContext(String text, Entry e, Map<String, Candidate> out) {
        EntityDefinition def = e.definition();
        Pattern phrase = phraseFor(def.type());
        if (phrase == null) return;
        for (String keyword : def.contextKeywords()) {
            Matcher k = keywordPattern(keyword).matcher(text);
            while (k.find()) {
                int from = Math.max(0, k.start() - CONTEXT_WINDOW);
                int to = Math.min(text.length(), k.end() + CONTEXT_WINDOW);
                Matcher m = phrase.matcher(text).region(from, to);
                while (m.find()) {
                    if (isKeyword(m.group(), def)) continue;
                    Candidate c = Candidate.of(
                                    def.type(), m.group(), m.start(), m.end(), CONTEXT_CONFIDENCE, CONTEXT_SOURCE)
                            .withAttributes(Map.of(
                                    DEFINITION_ATTRIBUTE, def.name(),
                                    METHOD_ATTRIBUTE, "context_heuristic"));
                    keepBest(out, c);
                }
            }
        }
    }

    private static Pattern phraseFor(EntityType type) {
        return switch (type) {
            case PERSON -> PERSON_PHRASE;
            case ORGANIZATION -> ORGANIZATION_PHRASE;
            case LOCATION -> LOCATION_PHRASE;
            default -> null;
        };
    }

    private static void keepBest(Map<String, Candidate> out, Candidate c) {
        String key = c.type().id() + ':' + c.start() + ':' + c.end();
        out.merge(key, c, (a, b) -> b.confidence() > a.confidence() ? b : a);
    }

    private static boolean hasKeywordNear(String text, int start, int end, EntityDefinition def) {
        String window = text.substring(Math.max(0, start - CONTEXT_WINDOW), Math.min(text.length(), end + CONTEXT_WINDOW))
                .toLowerCase(Locale.ROOT);
        for (String k : def.contextKeywords()) {
            if (window.contains(k.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static boolean isExample(String value, EntityDefinition def) {
        return def.examples().stream().anyMatch(value::equalsIgnoreCase);
    }

    private static boolean isKeyword(String value, EntityDefinition def) {
        return def.contextKeywords().stream().anyMatch(value::equalsIgnoreCase);
    }

    private static Pattern keywordPattern(String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static Entry compile(EntityDefinition def) {
        List<Pattern> compiled = new ArrayList<>(def.patterns().size());
        for (String regex : def.patterns()) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "Invalid pattern in definition '" + def.name() + "': " + e.getDescription(), e);
            }
        }
        Set<String> terms = new LinkedHashSet<>(words(def.name() + ' ' + def.description(), 0, Integer.MAX_VALUE));
        for (String k : def.contextKeywords()) terms.addAll(words(k, 0, Integer.MAX_VALUE));
        return new Entry(def, List.copyOf(compiled), Set.copyOf(terms));
    }

    /** Lower-cased words of at least {@code minLength} chars, the first {@code limit} of them. */
    private static Set<String> words(String text, int minLength, int limit) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find() && out.size() < limit) {
            if (m.group().length() >= minLength) out.add(m.group());
        }
        return out;
    }

    public static List<EntityDefinition> defaultDefinitions() {
        return List.of(
                new EntityDefinition(PERSON, "Person Name",
                        "Names of individuals, including first names, last names, and full names",
                        List.of("\\b[A-Z][a-z]+\\s+[A-Z][a-z]+\\b"),
                        List.of("name", "person", "individual", "mr", "mrs", "ms", "dr", "prof"),
                        Sensitivity.HIGH,
                        List.of("John Smith", "Dr. Sarah Johnson", "Mr. Robert Brown")),
                new EntityDefinition(EMAIL, "Email Address",
                        "Electronic mail addresses including personal and business emails",
                        List.of("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
                        List.of("email", "e-mail", "contact", "address"),
                        Sensitivity.HIGH,
                        List.of("john@example.com", "sarah.johnson@company.org")),
                new EntityDefinition(PHONE, "Phone Number",
                        "Telephone numbers including mobile, landline, and international numbers",
                        List.of("\\b\\d{3}-\\d{3}-\\d{4}\\b",
                                "\\(\\d{3}\\)\\s?\\d{3}-\\d{4}\\b",
                                "\\+1[-.\\s]?\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b"),
                        List.of("phone", "telephone", "mobile", "cell", "contact", "number"),
                        Sensitivity.MEDIUM,
                        List.of("555-123-4567", "(555) 123-4567", "+1 555 123 4567")),
                new EntityDefinition(SSN, "Social Security Number",
                        "US Social Security Numbers used for identification and benefits",
                        List.of("\\b\\d{3}-\\d{2}-\\d{4}\\b", "\\b\\d{3}\\s\\d{2}\\s\\d{4}\\b"),
                        List.of("ssn", "social security", "social security number"),
                        Sensitivity.CRITICAL,
                        List.of("123-45-6789", "123 45 6789")),
                new EntityDefinition(CREDIT_CARD, "Credit Card Number",
                        "Credit and debit card numbers from various issuers",
                        List.of("\\b4\\d{3}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b",
                                "\\b5[1-5]\\d{2}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b",
                                "\\b3[47]\\d{2}[-\\s]?\\d{6}[-\\s]?\\d{5}\\b"),
                        List.of("credit card", "debit card", "card number", "payment"),
                        Sensitivity.CRITICAL,
                        List.of("4532 1234 5678 9012", "5555 5555 5555 4444")),
                new EntityDefinition(ORGANIZATION, "Organization Name",
                        "Names of companies, institutions, and other organizations",
                        List.of("\\b[A-Z][a-zA-Z&.-]*(?:\\s+[A-Z][a-zA-Z&.-]*)*\\s+"
                                + "(?:Inc|LLC|Corp|Corporation|Company|Ltd|University|College)\\b"),
                        List.of("company", "organization", "corporation", "institute", "university"),
                        Sensitivity.LOW,
                        List.of("Acme Corporation", "State University", "ABC Company Inc.")),
                new EntityDefinition(ADDRESS, "Physical Address",
                        "Street addresses, postal addresses, and location information",
                        List.of("\\b\\d+\\s+[A-Za-z\\s]+(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd)\\b"),
                        List.of("address", "street", "avenue", "road", "location"),
                        Sensitivity.MEDIUM,
                        List.of("123 Main Street", "456 Oak Avenue")),
                new EntityDefinition(DATE, "Date Information",
                        "Dates that might reveal sensitive timing information",
                        List.of("\\b\\d{1,2}/\\d{1,2}/\\d{4}\\b",
                                "\\b\\d{4}-\\d{2}-\\d{2}\\b",
                                "\\b(?:January|February|March|April|May|June|July|August|September|October"
                                        + "|November|December)\\s+\\d{1,2},?\\s+\\d{4}\\b"),
                        List.of("date", "birth", "birthday", "born", "created", "expires"),
                        Sensitivity.MEDIUM,
                        List.of("01/15/1990", "2023-12-25", "January 1, 2023")),
                new EntityDefinition(IP_ADDRESS, "IP Address",
                        "Internet Protocol addresses that may reveal location or system information",
                        List.of("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"),
                        List.of("ip", "address", "server", "network"),
                        Sensitivity.MEDIUM,
                        List.of("192.168.1.1", "10.0.0.1")),
                new EntityDefinition(URL, "URL/Website",
                        "Website URLs and links that may contain sensitive information",
                        List.of("https?://[-\\w.]+(?::\\d+)?(?:/[\\w/_.]*)?"),
                        List.of("url", "website", "link", "http", "https"),
                        Sensitivity.LOW,
                        List.of("https://example.com", "http://internal.company.com")));
    }
}
