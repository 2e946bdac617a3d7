/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256 key for reversible tokens, derived once from a secret with PBKDF2-HMAC-SHA256.
 * Immutable; share one instance for the lifetime of the process.
 */
public final class TokenKey {
    static final String KDF = "PBKDF2WithHmacSHA256";
    static final int ITERATIONS = 100_000;
    static final int KEY_BITS = 256;
    private static final byte[] SALT = "pii_redaction_salt".getBytes(StandardCharsets.UTF_8);

    private final SecretKey key;

    private TokenKey(SecretKey key) {
        this.key = key;
    }

    /**
     * @throws IllegalArgumentException for a blank secret
     * @throws TokenizationException if the JVM lacks the key derivation function
     */
    public static TokenKey derive(String secret) {
        Objects.requireNonNull(secret, "secret");
        if (secret.isBlank()) throw new IllegalArgumentException("token secret must not be blank");
        char[] chars = secret.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, SALT, ITERATIONS, KEY_BITS);
        try {
            byte[] raw = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new TokenKey(new SecretKeySpec(raw, "AES"));
        } catch (GeneralSecurityException e) {
            throw new TokenizationException("Unable to derive token key", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }

    SecretKey secretKey() {
        return key;
    }

    @Override
    public String toString() {
        return "TokenKey[AES-256]";
    }
}
