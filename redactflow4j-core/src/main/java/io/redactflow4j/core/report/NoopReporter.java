/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.DetectedEntity;
import java.util.List;

public final class NoopReporter implements Reporter {
    @Override
    public void report(List<DetectedEntity> entities) {
        /* no-op */
    }
}
