/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.redact;

import static org.junit.jupiter.api.Assertions.*;

import io.redactflow4j.core.api.model.DetectedEntity;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RedactedEntity;
import io.redactflow4j.core.api.model.RedactionResult;
import io.redactflow4j.core.api.model.RedactionStrategy;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class TokenizerTest {

    private static TokenKey key;
    private static TokenKey otherKey;

    private final Tokenizer tokenizer = new Tokenizer();

    @BeforeAll
    public static void deriveKeys() {
        key = TokenKey.derive("correct horse battery staple");
        otherKey = TokenKey.derive("another secret");
    }

    @Test
    public void reversibleTokenRoundTrips() {
        Tokenizer.Token token = tokenizer.tokenize("123-45-6789", key);

        assertTrue(token.reversible());
        assertTrue(token.display().startsWith(Tokenizer.PREFIX));
        assertEquals(Tokenizer.PREFIX.length() + Tokenizer.DISPLAY_LENGTH, token.display().length());
        assertEquals(token.payload().substring(0, Tokenizer.DISPLAY_LENGTH), token.display().substring(4));
        assertEquals("123-45-6789", Tokenizer.reveal(token.payload(), key));
    }

    @Test
    public void sameValueEncryptsDifferentlyEachTime() {
        assertNotEquals(tokenizer.tokenize("secret", key).payload(), tokenizer.tokenize("secret", key).payload());
    }

    @Test
    public void wrongKeyIsReportedAsKeyMismatch() {
        String payload = tokenizer.tokenize("john.smith@company.com", key).payload();
        TokenizationException e =
                assertThrows(TokenKeyMismatchException.class, () -> Tokenizer.reveal(payload, otherKey));
        assertNotNull(e.getMessage());
    }

    @Test
    public void hashTokensCannotBeRevealed() {
        Tokenizer.Token token = tokenizer.tokenize("123-45-6789", null);

        assertFalse(token.reversible());
        assertNull(token.payload());
        assertEquals(Tokenizer.PREFIX + Tokenizer.sha256Hex("123-45-6789").substring(0, 15), token.display());
        assertThrows(IrreversibleTokenException.class, () -> Tokenizer.reveal(token.payload(), key));
    }

    @Test
    public void hashTokensAreStable() {
        assertEquals(tokenizer.tokenize("abc", null).display(), tokenizer.tokenize("abc", null).display());
    }

    @Test
    public void malformedPayloadsAreRejected() {
        assertThrows(TokenizationException.class, () -> Tokenizer.reveal("not base64 !!", key));
        assertThrows(TokenizationException.class, () -> Tokenizer.reveal("AAAA", key));
    }

    @Test
    public void blankSecretIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TokenKey.derive("  "));
        assertEquals("TokenKey[AES-256]", key.toString());
    }

    @Test
    public void engineKeepsThePayloadForReversal() {
        String text = "SSN 123-45-6789";
        DetectedEntity ssn = RedactionEngineTest.entity(text, "123-45-6789", EntityType.SSN, 0.95);
        RedactionResult r = new RedactionEngine().redact(
                text,
                List.of(ssn),
                RedactionOptions.defaults().withDefaultStrategy(RedactionStrategy.TOKENIZATION).withTokenKey(key));

        RedactedEntity e = r.entities().get(0);
        assertEquals("encryption", e.detail().method());
        assertTrue(e.detail().reversible());
        assertTrue(r.redactedText().startsWith("SSN TOK_"));
        assertEquals("123-45-6789", Tokenizer.reveal(e.detail().tokenPayload(), key));
    }
}
