/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RedactedEntity;
import io.redactflow4j.core.api.model.RedactionDetail;
import io.redactflow4j.core.api.model.RedactionResult;
import io.redactflow4j.core.api.model.RedactionStrategy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the original text entity by entity, from the end of the text towards its start, so offsets of
 * the entities still to come are never shifted by an earlier replacement.
 *
 * <p>An entity is skipped (and reported in {@link RedactionResult#skipped()}) when its span is empty, lies
 * outside the text, is unmappable, or overlaps a span that was already rewritten.
 */
public final class RedactionEngine {
    private static final Logger log = LoggerFactory.getLogger(RedactionEngine.class);

    static final int FIXED_MASK_LENGTH = 5;

    /** Processing order: start desc; at equal start the more confident, then the longer entity wins. */
    static final Comparator<DetectedEntity> PROCESSING_ORDER = Comparator.comparingInt(DetectedEntity::start)
            .reversed()
            .thenComparing(Comparator.comparingDouble(DetectedEntity::confidence).reversed())
            .thenComparing(Comparator.comparingInt((DetectedEntity e) -> e.end()).reversed());

    private final PartialMasker masker = new PartialMasker();
    private final Tokenizer tokenizer;

    public RedactionEngine() {
        this(new Tokenizer());
    }

    public RedactionEngine(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    public RedactionResult redact(String text, List<DetectedEntity> entities, RedactionOptions options) {
        if (text == null) return RedactionResult.failure("Text is null", null);
        RedactionOptions opts = options == null ? RedactionOptions.defaults() : options;
        long t0 = System.nanoTime();
        try {
            List<DetectedEntity> ordered = new ArrayList<>(entities == null ? List.of() : entities);
            ordered.sort(PROCESSING_ORDER);

            Pseudonymizer pseudonymizer = Pseudonymizer.create(opts.pseudonymSeed());
            StringBuilder out = new StringBuilder(text);
            Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
            List<RedactedEntity> done = new ArrayList<>();
            List<DetectedEntity> skipped = new ArrayList<>();
            int frontier = text.length();

            for (DetectedEntity e : ordered) {
                int s = e.start();
                int end = e.end();
                if (s < 0 || end > text.length() || s >= end) {
                    log.debug("Skipping entity {} with invalid span [{},{})", e.id(), s, end);
                    skipped.add(e);
                    continue;
                }
                if (end > frontier) {
                    log.debug("Skipping entity {} overlapping an already redacted span", e.id());
                    skipped.add(e);
                    continue;
                }
                String original = text.substring(s, end);
                Replacement r = replace(e.candidate(), original, opts, pseudonymizer);
                out.replace(s, end, r.value());
                frontier = s;
                done.add(new RedactedEntity(e, r.value(), r.detail()));
                if (r.detail().strategy() != RedactionStrategy.NONE) counts.merge(e.type(), 1, Integer::sum);
            }

            Duration took = Duration.ofNanos(System.nanoTime() - t0);
            log.debug("Redacted {} entities ({} skipped) in {} ms", done.size(), skipped.size(), took.toMillis());
            return new RedactionResult(
                    true, null, text, out.toString(), counts, done, skipped, took, Instant.now());
        } catch (RuntimeException ex) {
            log.warn("Redaction failed: {}", ex.toString());
            return RedactionResult.failure(String.valueOf(ex.getMessage()), text);
        }
    }

    private record Replacement(String value, RedactionDetail detail) {}

    private Replacement replace(Candidate c, String original, RedactionOptions opts, Pseudonymizer pseudonymizer) {
        RedactionStrategy strategy = opts.strategyFor(c.type());
        String custom = opts.customReplacements().get(c.type());
        if (custom != null) {
            return new Replacement(custom, RedactionDetail.of(strategy, "custom_replacement"));
        }
        char mask = opts.maskChar();
        switch (strategy) {
            case FULL_REMOVAL:
                return new Replacement("", RedactionDetail.of(strategy, "removal"));
            case FULL_MASK:
                int n = opts.preserveLength() ? original.length() : FIXED_MASK_LENGTH;
                return new Replacement(
                        String.valueOf(mask).repeat(n), RedactionDetail.masked(strategy, "full_mask", mask));
            case PARTIAL_MASK:
                return new Replacement(
                        masker.mask(c.type(), original, mask, opts.preserveFormat()),
                        RedactionDetail.masked(strategy, "partial_mask", mask));
            case TOKENIZATION:
                Tokenizer.Token token = tokenizer.tokenize(original, opts.tokenKey());
                return new Replacement(
                        token.display(),
                        new RedactionDetail(
                                strategy, token.reversible() ? "encryption" : "hash", token.reversible(), null,
                                token.payload()));
            case PSEUDONYMIZATION:
                return new Replacement(
                        pseudonymizer.pseudonym(c.type(), original), RedactionDetail.of(strategy, "pseudonym"));
            case GENERALIZATION:
                return new Replacement(placeholder(c), RedactionDetail.of(strategy, "category"));
            case NONE:
            default:
                return new Replacement(original, RedactionDetail.of(RedactionStrategy.NONE, "none"));
        }
    }

    static String placeholder(Candidate c) {
        if (c.type() == EntityType.CUSTOM) {
            String label = c.attributes().get(Candidate.CUSTOM_TYPE_ATTRIBUTE);
            if (label != null && !label.isBlank()) {
                return "[" + label.trim().replace('_', ' ').toUpperCase(Locale.ROOT) + "]";
            }
        }
        return c.type().placeholder();
    }
}
