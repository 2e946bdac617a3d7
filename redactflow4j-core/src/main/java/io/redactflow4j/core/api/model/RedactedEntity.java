/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** An entity together with the value that replaced it. */
public record RedactedEntity(DetectedEntity entity, String redactedValue, RedactionDetail detail) {}
