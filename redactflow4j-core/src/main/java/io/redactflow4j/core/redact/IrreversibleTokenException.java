/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

/** Reveal was asked for a hash token, which carries no recoverable payload. */
public class IrreversibleTokenException extends TokenizationException {
    public IrreversibleTokenException(String message) {
        super(message);
    }
}
