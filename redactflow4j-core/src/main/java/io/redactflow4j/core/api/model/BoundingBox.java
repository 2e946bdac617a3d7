/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Page-anchored location of a finding, supplied by OCR-backed sources. */
public record BoundingBox(double x, double y, double width, double height, int page) {}
