/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.aggregate.AggregationEngine;
import io.redactflow4j.core.aggregate.MdcAwareExecutor;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.DetectionResult;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.Range;
import io.redactflow4j.core.api.model.RedactionResult;
import io.redactflow4j.core.detect.CustomRuleDetector;
import io.redactflow4j.core.enrich.EnrichmentStage;
import io.redactflow4j.core.normalize.ProcessedDocument;
import io.redactflow4j.core.normalize.TextNormalizer;
import io.redactflow4j.core.preset.DetectorRegistry;
import io.redactflow4j.core.redact.RedactionEngine;
import io.redactflow4j.core.redact.RedactionOptions;
import io.redactflow4j.core.report.DetectionStats;
import io.redactflow4j.core.report.NoopReporter;
import io.redactflow4j.core.report.Reporter;
import io.redactflow4j.core.report.StatsSnapshot;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: normalize, detect, map back, enrich, and optionally redact.
 *
 * <p>Public methods never throw for bad input or detector trouble; they return failure results instead.
 * The pipeline owns its detector executor unless one was supplied, and shuts it down in {@link #close()}.
 */
public final class RedactionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedactionPipeline.class);

    public static final String POSITION_APPROXIMATE = "position_approximate";
    public static final String PROCESSED_START = "processed_start";
    public static final String PROCESSED_END = "processed_end";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AggregationEngine aggregation;
    private final TextNormalizer normalizer;
    private final EnrichmentStage enrichment;
    private final RedactionEngine redaction;
    private final DetectionStats stats = new DetectionStats();
    private final Reporter reporter;
    private final MdcAwareExecutor ownedExecutor;
    private final AtomicBoolean initialized = new AtomicBoolean();

    /** Built-in detectors with default settings. */
    public RedactionPipeline() {
        this(new DetectorRegistry().defaults(), PipelineSettings.defaults());
    }

    public RedactionPipeline(List<Detector> detectors, PipelineSettings settings) {
        this(detectors, settings, null, new NoopReporter());
    }

    /**
     * @param executor runs detector tasks; null makes the pipeline create and own one
     * @param reporter receives every finished detection; null means none
     */
    public RedactionPipeline(List<Detector> detectors, PipelineSettings settings, Executor executor, Reporter reporter) {
        Objects.requireNonNull(detectors, "detectors");
        Objects.requireNonNull(settings, "settings");
        this.ownedExecutor = executor == null ? MdcAwareExecutor.forDetectors() : null;
        this.aggregation = new AggregationEngine(detectors, settings, executor == null ? ownedExecutor : executor);
        this.normalizer = new TextNormalizer();
        this.enrichment = new EnrichmentStage();
        this.redaction = new RedactionEngine();
        this.reporter = reporter == null ? new NoopReporter() : reporter;
    }

    /** Warms every detector up once; later calls do nothing. */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) return;
        aggregation.warmUp();
        log.info("Redaction pipeline initialized with {} detectors", aggregation.detectors().size());
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public DetectionResult detectCandidates(String text, DetectionOptions options) {
        if (text == null || text.isBlank()) return DetectionResult.failure("Empty text provided");
        DetectionOptions opts = options == null ? DetectionOptions.defaults() : options;
        try {
            initialize();
            ProcessedDocument doc = opts.preprocess()
                    ? normalizer.normalize(text, opts.effectiveSteps(), opts.sourceMetadata())
                    : ProcessedDocument.of(text, opts.sourceMetadata());

            AggregationEngine.Outcome outcome = aggregation.run(doc.processedText(), opts);
            List<Candidate> mapped = new ArrayList<>(outcome.candidates().size());
            for (Candidate c : outcome.candidates()) {
                Candidate m = toOriginal(doc, c);
                if (m != null) mapped.add(m);
            }

            List<DetectedEntity> entities =
                    enrichment.enrich(text, mapped, opts.contextWindow(), patternSources());
            stats.record(entities);
            publish(entities);

            PipelineSettings settings = aggregation.settings();
            log.debug("Detected {} entities in {} chars", entities.size(), text.length());
            return new DetectionResult(
                    true,
                    null,
                    entities,
                    doc.metadata(),
                    outcome.detectorsUsed(),
                    settings.confidenceThreshold(),
                    settings.mergeThreshold(),
                    text.length(),
                    wordCount(text));
        } catch (RuntimeException e) {
            log.error("Detection failed: {}", e.toString(), e);
            return DetectionResult.failure(String.valueOf(e.getMessage()));
        }
    }

    public DetectionResult detectCandidates(String text) {
        return detectCandidates(text, DetectionOptions.defaults());
    }

    public RedactionResult redact(String text, List<DetectedEntity> entities, RedactionOptions options) {
        return redaction.redact(text, entities, options);
    }

    /** Detects with {@code detection} and, when that succeeds, redacts with {@code options}. */
    public RedactionResult detectAndRedact(String text, DetectionOptions detection, RedactionOptions options) {
        DetectionResult found = detectCandidates(text, detection);
        if (!found.success()) return RedactionResult.failure(found.failureReason(), text);
        return redact(text, found.entities(), options);
    }

    public RedactionResult detectAndRedact(String text) {
        return detectAndRedact(text, DetectionOptions.defaults(), RedactionOptions.defaults());
    }

    public StatsSnapshot stats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
    }

    public void registerDetector(Detector detector) {
        aggregation.register(detector);
        if (initialized.get()) {
            try {
                detector.warmUp();
            } catch (RuntimeException e) {
                log.warn("Detector '{}' warm-up failed: {}", detector.name(), e.toString());
            }
        }
    }

    public boolean unregisterDetector(String name) {
        return aggregation.unregister(name);
    }

    public List<Detector> detectors() {
        return aggregation.detectors();
    }

    /**
     * Adds a user regex to the {@code custom_rules} detector, registering that detector first when absent.
     *
     * @return the generated rule name
     * @throws IllegalArgumentException when the pattern does not compile or the confidence is out of range
     */
    public String addCustomRule(String pattern, EntityType type, double confidence) {
        CustomRuleDetector custom = aggregation
                .find(CustomRuleDetector.NAME)
                .filter(CustomRuleDetector.class::isInstance)
                .map(CustomRuleDetector.class::cast)
                .orElseGet(() -> {
                    CustomRuleDetector d = new CustomRuleDetector();
                    aggregation.register(d);
                    return d;
                });
        return custom.addRule(pattern, type, confidence, null);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) ownedExecutor.close();
    }

    /** Translates a processed-text candidate to original offsets; null when it cannot be placed. */
    private static Candidate toOriginal(ProcessedDocument doc, Candidate c) {
        String original = doc.originalText();
        Range r = doc.mapRange(c.start(), c.end());
        boolean approximate = false;
        if (r.isUnmappable()) {
            r = doc.estimateRange(c.start(), c.end());
            approximate = true;
        }
        if (r.isUnmappable() || r.end() > original.length() || r.length() == 0) {
            log.debug("Dropping candidate {}: span [{},{}) has no original position", c.id(), c.start(), c.end());
            return null;
        }
        Candidate out = c;
        if (r.start() != c.start() || r.end() != c.end()) {
            out = out.withAttribute(PROCESSED_START, Integer.toString(c.start()))
                    .withAttribute(PROCESSED_END, Integer.toString(c.end()));
        }
        if (approximate) out = out.withAttribute(POSITION_APPROXIMATE, "true");
        // a merged candidate keeps its base match; its span is the union
        String matched = c.isMerged() ? c.text() : original.substring(r.start(), r.end());
        return out.withSpan(r.start(), r.end(), matched);
    }

    private Set<String> patternSources() {
        Set<String> names = new HashSet<>();
        for (Detector d : aggregation.detectors()) {
            if (d.kind() == DetectorKind.PATTERN) names.add(d.name());
        }
        return names;
    }

    private void publish(List<DetectedEntity> entities) {
        try {
            reporter.report(entities);
        } catch (RuntimeException e) {
            log.warn("Reporter failed: {}", e.toString());
        }
    }

    static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
