/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.report;

import io.redactflow4j.core.api.model.DetectedEntity;
import java.util.List;

/** Receives the entities of every finished detection run. Must not throw and must not block. */
public interface Reporter {
    void report(List<DetectedEntity> entities);
}
