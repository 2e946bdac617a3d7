/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import static io.redactflow4j.core.api.model.EntityType.*;

import io.redactflow4j.core.api.DetectorKind;
import io.redactflow4j.core.api.model.Candidate;
import io.redactflow4j.core.api.model.EntityType;
import java.util.List;

/**
 * Keyword-anchored financial identifiers: card security data, bank and brokerage accounts, routing and
 * SWIFT codes, IBANs, tax ids and crypto wallet addresses. Only the value after the keyword is claimed.
 */
public final class FinancialDetector extends RegexDetector {
    public static final String NAME = "financial";
    public static final String SUBTYPE_ATTRIBUTE = "financial_subtype";

    private static final String KV = "\\s*[:#]?\\s*";

    public FinancialDetector() {
        super(NAME, DetectorKind.DOMAIN, defaultRules());
    }

    static List<PatternRule> defaultRules() {
        return List.of(
                keyed("cvv", "(?i:CVV|CVC|CVV2|Security\\s+Code)" + KV + "(?<val>\\d{3,4})\\b", CREDIT_CARD, 0.95, "cvv"),
                keyed(
                        "card_expiry",
                        "(?i:Expir(?:y|ation)(?:\\s+Date)?|Exp)" + KV + "(?<val>(?:0[1-9]|1[0-2])[/.-](?:\\d{2}|\\d{4}))\\b",
                        CREDIT_CARD,
                        0.9,
                        "expiration_date"),
                keyed("routing_number", "(?i:Routing|ABA)(?:\\s+(?i:number|no\\.?))?" + KV + "(?<val>\\d{9})\\b",
                        BANK_ACCOUNT, 0.95, "routing_number"),
                keyed("account_number",
                        "(?i:Account|Acct)(?:\\s+(?i:number|no\\.?))?" + KV + "(?<val>\\d{6,17})\\b",
                        BANK_ACCOUNT, 0.9, "account_number"),
                keyed("swift_code",
                        "(?i:SWIFT|BIC)" + KV + "(?<val>[A-Z]{6}[A-Z0-9]{2}(?:[A-Z0-9]{3})?)\\b",
                        CUSTOM, 0.95, "swift_code")
                        .withAttribute(Candidate.CUSTOM_TYPE_ATTRIBUTE, "swift_code"),
                keyed("iban_keyed", "(?i:IBAN)" + KV + "(?<val>[A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){2,7}(?: ?[A-Z0-9]{1,3})?)\\b",
                        IBAN, 0.95, "iban")
                        .accepting(IbanDetector::isValidFormatted),
                keyed("investment_account",
                        "(?i:Portfolio|Brokerage|401k|IRA)" + KV + "(?<val>(?=[A-Z]*\\d)[A-Z0-9]{5,12})\\b",
                        BANK_ACCOUNT, 0.85, "investment_account"),
                keyed("ein", "(?i:EIN|Tax\\s+ID)" + KV + "(?<val>\\d{2}-\\d{7})\\b", TAX_ID, 0.9, "ein"),
                keyed("tin", "(?i:TIN)" + KV + "(?<val>\\d{9})\\b", TAX_ID, 0.9, "tin"),
                keyed("bitcoin", "\\b(?<val>(?:bc1[a-z0-9]{25,39}|[13][a-km-zA-HJ-NP-Z1-9]{25,34}))\\b",
                        CRYPTO_ADDRESS, 0.9, "bitcoin"),
                keyed("ethereum", "\\b(?<val>0x[a-fA-F0-9]{40})\\b", CRYPTO_ADDRESS, 0.9, "ethereum"));
    }

    private static PatternRule keyed(String name, String regex, EntityType type, double confidence, String subtype) {
        String anchored = regex.startsWith("\\b") ? regex : "\\b" + regex;
        return PatternRule.of(name, anchored, type, confidence).withAttribute(SUBTYPE_ATTRIBUTE, subtype);
    }
}
