/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api;

/** How a detector arrives at its claims; enrichment rewards {@link #PATTERN} hits that validate. */
public enum DetectorKind {
    PATTERN,
    DOMAIN,
    STATISTICAL
}
