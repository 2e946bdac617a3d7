/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.RedactionPipeline;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "redactflow")
public class RedactflowEndpoint {

    private final RedactionPipeline pipeline;
    private final MicrometerReporter reporter; // may be null

    public RedactflowEndpoint(RedactionPipeline pipeline, MicrometerReporter reporter) {
        this.pipeline = pipeline;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", pipeline.isInitialized() ? "UP" : "STARTING");
        m.put("detectors", pipeline.detectors().stream().map(Detector::name).toList());
        m.put("stats", pipeline.stats());
        m.put("recentFindings", reporter == null ? List.of() : reporter.recentFindings());
        return m;
    }
}
