/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.aggregate;

import io.redactflow4j.core.api.DetectionOptions;
import io.redactflow4j.core.api.Detector;
import io.redactflow4j.core.api.PipelineSettings;
import io.redactflow4j.core.api.model.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out / fan-in over the registered detectors, followed by merge, threshold filter and ordering.
 *
 * <p>Every enabled detector runs as its own task with its own timeout. A detector that throws, times out
 * or returns garbage contributes nothing; the run itself always completes. A detector that times out is
 * interrupted so its worker can be reused.
 */
public final class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    /** Final order: confidence desc, then start asc. */
    public static final Comparator<Candidate> RESULT_ORDER = Comparator.comparingDouble(Candidate::confidence)
            .reversed()
            .thenComparingInt(Candidate::start)
            .thenComparingInt(Candidate::end);

    private final CopyOnWriteArrayList<Detector> detectors;
    private final PipelineSettings settings;
    private final CandidateMerger merger;
    private final Executor executor;

    public AggregationEngine(List<Detector> detectors, PipelineSettings settings, Executor executor) {
        this.detectors = new CopyOnWriteArrayList<>(Objects.requireNonNull(detectors, "detectors"));
        this.settings = Objects.requireNonNull(settings, "settings");
        this.merger = new CandidateMerger(settings.mergeThreshold());
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /** What one run produced, plus which detectors took part. */
    public record Outcome(List<Candidate> candidates, List<String> detectorsUsed, List<String> detectorsFailed) {
        public Outcome {
            candidates = List.copyOf(candidates);
            detectorsUsed = List.copyOf(detectorsUsed);
            detectorsFailed = List.copyOf(detectorsFailed);
        }
    }

    private record DetectorRun(Detector detector, List<Candidate> candidates, boolean failed) {}

    public List<Candidate> process(String text, DetectionOptions options) {
        return run(text, options).candidates();
    }

    public Outcome run(String text, DetectionOptions options) {
        Objects.requireNonNull(text, "text");
        DetectionOptions opts = options == null ? DetectionOptions.defaults() : options;

        List<Detector> active = new ArrayList<>();
        for (Detector d : detectors) {
            if (opts.isDetectorEnabled(d.name()) && handlesRequestedTypes(d, opts)) active.add(d);
        }

        // fan-out
        List<CompletableFuture<DetectorRun>> futures = new ArrayList<>(active.size());
        long timeoutMs = settings.detectorTimeout().toMillis();
        for (Detector d : active) {
            futures.add(launch(d, text, opts, timeoutMs));
        }

        // fan-in
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<Candidate> raw = new ArrayList<>();
        List<String> used = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (CompletableFuture<DetectorRun> f : futures) {
            DetectorRun r = f.join();
            used.add(r.detector().name());
            if (r.failed()) failed.add(r.detector().name());
            raw.addAll(r.candidates());
        }

        List<Candidate> merged = merger.merge(raw);
        List<Candidate> kept = new ArrayList<>(merged.size());
        for (Candidate c : merged) {
            if (c.confidence() >= settings.confidenceThreshold()) kept.add(c);
        }
        kept.sort(RESULT_ORDER);
        log.debug("Aggregated {} raw candidates into {} ({} detectors, {} failed)",
                raw.size(), kept.size(), used.size(), failed.size());
        return new Outcome(kept, used, failed);
    }

    private CompletableFuture<DetectorRun> launch(Detector d, String text, DetectionOptions opts, long timeoutMs) {
        CompletableFuture<List<Candidate>> result = new CompletableFuture<>();
        FutureTask<List<Candidate>> task = new FutureTask<>(() -> d.detect(text, opts)) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    result.cancel(false);
                    return;
                }
                try {
                    result.complete(get());
                } catch (ExecutionException e) {
                    result.completeExceptionally(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    result.completeExceptionally(e);
                }
            }
        };
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((list, ex) -> {
                    // frees the worker of a detector that overran or was never started
                    if (ex != null) task.cancel(true);
                })
                .handle((list, ex) -> settle(d, text, opts, list, ex));
    }

    private static DetectorRun settle(
            Detector d, String text, DetectionOptions opts, List<Candidate> list, Throwable ex) {
        if (ex != null) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TimeoutException) {
                log.warn("Detector '{}' timed out, ignoring its results", d.name());
            } else {
                log.warn("Detector '{}' failed, ignoring its results: {}", d.name(), cause.toString());
            }
            return new DetectorRun(d, List.of(), true);
        }
        if (list == null) return new DetectorRun(d, List.of(), false);
        List<Candidate> valid = new ArrayList<>(list.size());
        for (Candidate c : list) {
            if (c == null) continue;
            if (c.end() > text.length()) {
                log.debug("Detector '{}' returned span [{},{}) past end of text, dropped", d.name(), c.start(), c.end());
                continue;
            }
            if (!opts.wants(c.type())) continue;
            valid.add(c);
        }
        return new DetectorRun(d, valid, false);
    }

    private static boolean handlesRequestedTypes(Detector d, DetectionOptions opts) {
        if (opts.entityTypes().isEmpty()) return true;
        try {
            return d.supportedTypes().stream().anyMatch(opts::wants);
        } catch (RuntimeException e) {
            log.warn("Detector '{}' failed to report its types: {}", d.name(), e.toString());
            return false;
        }
    }

    /** Pre-warms every detector; a detector that fails to warm up stays registered. */
    public void warmUp() {
        for (Detector d : detectors) {
            try {
                d.warmUp();
            } catch (RuntimeException e) {
                log.warn("Detector '{}' warm-up failed: {}", d.name(), e.toString());
            }
        }
    }

    /** Adds a detector, replacing any registered detector with the same name. */
    public void register(Detector detector) {
        Objects.requireNonNull(detector, "detector");
        detectors.removeIf(d -> d.name().equals(detector.name()));
        detectors.add(detector);
        log.info("Detector '{}' registered", detector.name());
    }

    public boolean unregister(String name) {
        boolean removed = detectors.removeIf(d -> d.name().equals(name));
        if (removed) log.info("Detector '{}' unregistered", name);
        return removed;
    }

    public Optional<Detector> find(String name) {
        return detectors.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    public List<Detector> detectors() {
        return List.copyOf(detectors);
    }

    public PipelineSettings settings() {
        return settings;
    }
}
