/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;
import java.util.Set;

/**
 * Stateless recognizer that returns candidates for the text it is given.
 *
 * <p>Implementations must be safe to call from several threads at once, must not mutate shared state and
 * must not let exceptions escape {@link #detect}: an internal failure yields an empty list. Offsets of the
 * returned candidates refer to {@code text} exactly as passed in.
 */
public interface Detector {
    /** Stable id, also used as {@link Candidate#source()}. */
    String name();

    DetectorKind kind();

    Set<EntityType> supportedTypes();

    List<Candidate> detect(String text, DetectionOptions options);

    /** Optional one-time warm-up (pattern compilation, model loading). */
    default void warmUp() {}
}
