/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.normalize.NormalizationStep;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only per-run options handed to every detector.
 *
 * @param entityTypes requested types; empty means all
 * @param disabledDetectors detector names switched off for this run
 * @param preprocess whether the text goes through the normalizer first
 * @param steps normalization steps; empty means {@link NormalizationStep#defaults()}
 * @param contextWindow characters of context captured on each side of an entity
 * @param sourceMetadata opaque metadata from the text supplier (file id, page, ...)
 */
public record DetectionOptions(
        Set<EntityType> entityTypes,
        Set<String> disabledDetectors,
        boolean preprocess,
        List<NormalizationStep> steps,
        int contextWindow,
        Map<String, String> sourceMetadata) {

    public static final int DEFAULT_CONTEXT_WINDOW = 50;

    public DetectionOptions {
        entityTypes = entityTypes == null || entityTypes.isEmpty() ? Set.of() : Set.copyOf(entityTypes);
        disabledDetectors = disabledDetectors == null ? Set.of() : Set.copyOf(disabledDetectors);
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (contextWindow < 0) throw new IllegalArgumentException("contextWindow must be >= 0");
        sourceMetadata = sourceMetadata == null ? Map.of() : Map.copyOf(sourceMetadata);
    }

    public static DetectionOptions defaults() {
        return new DetectionOptions(Set.of(), Set.of(), true, List.of(), DEFAULT_CONTEXT_WINDOW, Map.of());
    }

    public boolean isDetectorEnabled(String name) {
        return !disabledDetectors.contains(name);
    }

    public boolean wants(EntityType type) {
        return entityTypes.isEmpty() || entityTypes.contains(type);
    }

    public List<NormalizationStep> effectiveSteps() {
        return steps.isEmpty() ? NormalizationStep.defaults() : steps;
    }

    public DetectionOptions withEntityTypes(EntityType first, EntityType... rest) {
        return new DetectionOptions(
                EnumSet.of(first, rest), disabledDetectors, preprocess, steps, contextWindow, sourceMetadata);
    }

    public DetectionOptions withDisabledDetectors(Set<String> names) {
        return new DetectionOptions(entityTypes, names, preprocess, steps, contextWindow, sourceMetadata);
    }

    public DetectionOptions withPreprocess(boolean value) {
        return new DetectionOptions(entityTypes, disabledDetectors, value, steps, contextWindow, sourceMetadata);
    }

    public DetectionOptions withSteps(List<NormalizationStep> value) {
        return new DetectionOptions(entityTypes, disabledDetectors, preprocess, value, contextWindow, sourceMetadata);
    }

    public DetectionOptions withContextWindow(int value) {
        return new DetectionOptions(entityTypes, disabledDetectors, preprocess, steps, value, sourceMetadata);
    }

    public DetectionOptions withSourceMetadata(Map<String, String> value) {
        return new DetectionOptions(
                entityTypes, disabledDetectors, preprocess, steps, contextWindow, Objects.requireNonNull(value));
    }
}
