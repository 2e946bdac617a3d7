/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.RedactionPipeline;
import io.redactflow4j.core.preset.DetectorRegistry;
import io.redactflow4j.core.redact.RedactionOptions;
import io.redactflow4j.core.report.NoopReporter;
import io.redactflow4j.core.report.Reporter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds a {@link RedactionPipeline} from {@code redactflow4j.*} properties, with optional metrics and endpoint. */
@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(RedactflowProperties.class)
@ConditionalOnProperty(prefix = "redactflow4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedactflowAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerReporter redactflowMicrometerReporter(MeterRegistry registry, RedactflowProperties props) {
            return new MicrometerReporter(registry, props.getRecentFindings());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RedactflowEndpoint redactflowEndpoint(
                RedactionPipeline pipeline, ObjectProvider<MicrometerReporter> micrometer) {
            return new RedactflowEndpoint(pipeline, micrometer.getIfAvailable());
        }
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter redactflowReporter() {
        return new NoopReporter();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RedactionPipeline redactionPipeline(RedactflowProperties props, Reporter reporter) {
        List<Detector> detectors = new DetectorRegistry().build(props.getDetectors(), props.toCustomRules());
        RedactionPipeline pipeline = new RedactionPipeline(detectors, props.toSettings(), null, reporter);
        pipeline.initialize();
        log.info("Redactflow4J pipeline ready: detectors={}, confidenceThreshold={}",
                detectors.stream().map(Detector::name).toList(), props.getConfidenceThreshold());
        return pipeline;
    }

    @Bean
    @ConditionalOnMissingBean
    public RedactionOptions redactionOptions(RedactflowProperties props) {
        return props.getRedaction().toOptions();
    }
}
