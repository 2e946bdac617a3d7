/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.api.model;

/**
 * Audit record of how one entity was rewritten.
 *
 * @param reversible null when the notion does not apply (only tokenization sets it)
 * @param maskChar null unless a masking method ran
 * @param tokenPayload full reversible payload; null for every other method
 */
public record RedactionDetail(
        RedactionStrategy strategy, String method, Boolean reversible, Character maskChar, String tokenPayload) {

    public static RedactionDetail of(RedactionStrategy strategy, String method) {
        return new RedactionDetail(strategy, method, null, null, null);
    }

    public static RedactionDetail masked(RedactionStrategy strategy, String method, char maskChar) {
        return new RedactionDetail(strategy, method, null, maskChar, null);
    }
}
