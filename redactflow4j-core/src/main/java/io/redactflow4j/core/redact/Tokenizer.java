/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

/**
 * Token strategy.
 *
 * <p>With a {@link TokenKey} the value is encrypted with AES-256-GCM; the payload is
 * {@code base64url(iv || ciphertext+tag)} and the text shows {@code TOK_} plus its first 15 chars.
 * Without a key the value is hashed (SHA-256) and the text shows {@code TOK_} plus 15 hex chars; such a
 * token has no payload and cannot be revealed.
 */
public final class Tokenizer {
    public static final String PREFIX = "TOK_";
    public static final int DISPLAY_LENGTH = 15;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecureRandom random;

    public Tokenizer() {
        this(new SecureRandom());
    }

    Tokenizer(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param display text written into the redacted document
     * @param payload full reversible payload, null for hash tokens
     */
    public record Token(String display, String payload, boolean reversible) {}

    public Token tokenize(String value, TokenKey key) {
        Objects.requireNonNull(value, "value");
        if (key == null) {
            String hex = sha256Hex(value);
            return new Token(PREFIX + hex.substring(0, DISPLAY_LENGTH), null, false);
        }
        String payload = encrypt(value, key);
        return new Token(PREFIX + payload.substring(0, Math.min(DISPLAY_LENGTH, payload.length())), payload, true);
    }

    /**
     * Recovers the original value of a reversible token.
     *
     * @throws IrreversibleTokenException when {@code payload} is null (hash token)
     * @throws TokenKeyMismatchException when {@code key} is not the key the token was made with
     * @throws TokenizationException for a malformed payload
     */
    public static String reveal(String payload, TokenKey key) {
        Objects.requireNonNull(key, "key");
        if (payload == null) throw new IrreversibleTokenException("Token was produced without a key and cannot be revealed");
        byte[] combined;
        try {
            combined = DECODER.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new TokenizationException("Token payload is not valid base64url", e);
        }
        if (combined.length < GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new TokenizationException("Token payload too short to contain IV and tag");
        }
        byte[] iv = Arrays.copyOfRange(combined, 0, GCM_IV_LENGTH);
        byte[] encrypted = Arrays.copyOfRange(combined, GCM_IV_LENGTH, combined.length);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new TokenKeyMismatchException("Token was not produced with this key", e);
        } catch (GeneralSecurityException e) {
            throw new TokenizationException("Unable to reveal token", e);
        }
    }

    private String encrypt(String value, TokenKey key) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encrypted = cipher.doFinal(value.getBytes(StandardCharsets.UTF_8));
            // IV + ciphertext (GCM appends the tag)
            byte[] combined = ByteBuffer.allocate(iv.length + encrypted.length).put(iv).put(encrypted).array();
            return ENCODER.encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new TokenizationException("Unable to create token", e);
        }
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new TokenizationException("SHA-256 not available", e);
        }
    }
}
