/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/** Text surrounding an entity in the original document. */
public record Context(String before, String entity, String after) {
    public String full() {
        return before + entity + after;
    }
}
