/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.PipelineSettings;
import io.redactflow4j.core.api.RedactionPipeline;
import io.redactflow4j.core.api.model.DetectionResult;
import io.redactflow4j.core.api.model.EntityType;
import io.redactflow4j.core.api.model.RedactionStrategy;
import io.redactflow4j.core.detect.RuleBasedDetector;
import io.redactflow4j.core.redact.RedactionOptions;
import io.redactflow4j.core.report.NoopReporter;
import io.redactflow4j.core.report.Reporter;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RedactflowAutoConfigurationTest {

    private static final String LINE = "Contact John Smith at john.smith@company.com or 555-123-4567, SSN 123-45-6789";

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withConfiguration(AutoConfigurations.of(RedactflowAutoConfiguration.class));

    private static List<String> names(RedactionPipeline pipeline) {
        return pipeline.detectors().stream().map(Detector::name).toList();
    }

    @Test
    void defaultsBuildAnInitializedPipeline() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(RedactionPipeline.class);
            assertThat(ctx).hasSingleBean(RedactflowEndpoint.class);
            assertThat(ctx).doesNotHaveBean(MicrometerReporter.class);
            assertThat(ctx.getBean(Reporter.class)).isInstanceOf(NoopReporter.class);

            RedactionPipeline pipeline = ctx.getBean(RedactionPipeline.class);
            assertThat(pipeline.isInitialized()).isTrue();
            assertThat(names(pipeline)).startsWith("rule_based").contains("person_name", "custom_rules");
            assertThat(pipeline.detectAndRedact(LINE).redactedText()).endsWith("SSN XXX-XX-6789");
        });
    }

    @Test
    void canBeSwitchedOff() {
        runner.withPropertyValues("redactflow4j.enabled=false").run(ctx -> {
            assertThat(ctx).doesNotHaveBean(RedactionPipeline.class);
            assertThat(ctx).doesNotHaveBean(RedactflowEndpoint.class);
        });
    }

    @Test
    void propertiesShapeThePipeline() {
        runner.withPropertyValues(
                        "redactflow4j.detectors=rule-based",
                        "redactflow4j.confidence-threshold=0.6",
                        "redactflow4j.detector-timeout=2s",
                        "redactflow4j.custom-rules[0].name=badge",
                        "redactflow4j.custom-rules[0].pattern=EMP-[0-9]{6}",
                        "redactflow4j.custom-rules[0].label=employee_id")
                .run(ctx -> {
                    RedactionPipeline pipeline = ctx.getBean(RedactionPipeline.class);
                    assertThat(names(pipeline)).containsExactly("rule_based", "custom_rules");

                    DetectionResult r = pipeline.detectCandidates("Badge EMP-123456 for jane@example.org");
                    assertThat(r.confidenceThreshold()).isEqualTo(0.6);
                    assertThat(r.entities())
                            .anySatisfy(e -> assertThat(e.text()).isEqualTo("EMP-123456"))
                            .anySatisfy(e -> assertThat(e.text()).isEqualTo("jane@example.org"));
                });
    }

    @Test
    void redactionOptionsComeFromProperties() {
        runner.withPropertyValues(
                        "redactflow4j.redaction.strategy=full-mask",
                        "redactflow4j.redaction.mask-char=#",
                        "redactflow4j.redaction.preserve-length=false")
                .run(ctx -> {
                    RedactionOptions options = ctx.getBean(RedactionOptions.class);
                    assertThat(options.defaultStrategy()).isEqualTo(RedactionStrategy.FULL_MASK);
                    assertThat(options.maskChar()).isEqualTo('#');
                    assertThat(options.tokenKey()).isNull();

                    RedactionPipeline pipeline = ctx.getBean(RedactionPipeline.class);
                    String text = "SSN 123-45-6789";
                    var found = pipeline.detectCandidates(text);
                    assertThat(pipeline.redact(text, found.entities(), options).redactedText())
                            .isEqualTo("SSN #####");
                });
    }

    @Test
    void replacementsAreBoundPerEntityType() {
        runner.withPropertyValues(
                        "redactflow4j.redaction.strategy=full-mask",
                        "redactflow4j.redaction.replacements.ssn=[REDACTED]")
                .run(ctx -> {
                    RedactionOptions options = ctx.getBean(RedactionOptions.class);
                    assertThat(options.customReplacements()).containsEntry(EntityType.SSN, "[REDACTED]");

                    RedactionPipeline pipeline = ctx.getBean(RedactionPipeline.class);
                    String text = "SSN 123-45-6789";
                    var found = pipeline.detectCandidates(text);
                    assertThat(pipeline.redact(text, found.entities(), options).redactedText())
                            .isEqualTo("SSN [REDACTED]");
                });
    }

    @Test
    void tokenSecretEnablesReversibleTokens() {
        runner.withPropertyValues("redactflow4j.redaction.token-secret=s3cret").run(ctx -> {
            assertThat(ctx.getBean(RedactionOptions.class).tokenKey()).isNotNull();
        });
    }

    @Test
    void invalidThresholdFailsStartup() {
        runner.withPropertyValues("redactflow4j.confidence-threshold=1.5")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void meterRegistryTurnsOnMetrics() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(ctx -> {
            assertThat(ctx).hasSingleBean(MicrometerReporter.class);
            assertThat(ctx.getBean(Reporter.class)).isSameAs(ctx.getBean(MicrometerReporter.class));

            ctx.getBean(RedactionPipeline.class).detectCandidates(LINE);

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.get(MicrometerReporter.COUNTER)
                            .tag("type", "ssn")
                            .counter()
                            .count())
                    .isEqualTo(1.0);
            assertThat(ctx.getBean(MicrometerReporter.class).recentFindings()).hasSize(4);
        });
    }

    @Test
    void userPipelineWins() {
        runner.withBean(
                        RedactionPipeline.class,
                        () -> new RedactionPipeline(List.of(new RuleBasedDetector()), PipelineSettings.defaults()))
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(RedactionPipeline.class);
                    assertThat(names(ctx.getBean(RedactionPipeline.class))).containsExactly("rule_based");
                });
    }

    @Test
    void customTimeoutIsBound() {
        runner.withPropertyValues("redactflow4j.detector-timeout=250ms").run(ctx -> {
            assertThat(ctx.getBean(RedactflowProperties.class).toSettings().detectorTimeout())
                    .isEqualTo(Duration.ofMillis(250));
        });
    }
}
