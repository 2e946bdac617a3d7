/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** One input absorbed by a merged candidate. */
public record Provenance(String candidateId, String source, double confidence) {}
