/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

/** The payload was not produced with the key used to reveal it, or it was tampered with. */
public class TokenKeyMismatchException extends TokenizationException {
    public TokenKeyMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
