/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.detect;

import java.util.List;

/**
 * Black-box entity recognizer (NER model, remote service, ...). Only its output shape matters here:
 * labelled spans with a score. Implementations may throw; {@link RecognizerDetector} contains the failure.
 */
@FunctionalInterface
public interface Recognizer {

    List<Recognition> recognize(String text) throws Exception;

    /**
     * One recognized span.
     *
     * @param label model label, optionally BIO-prefixed ({@code B-PER}, {@code I-ORG})
     * @param score model score in [0,1]
     */
    record Recognition(String label, int start, int end, double score) {}
}
