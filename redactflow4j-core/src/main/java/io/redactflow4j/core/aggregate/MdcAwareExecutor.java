/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.aggregate;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Pool of daemon workers that run each task with the submitting thread's MDC, so detector log
 * lines carry the caller's correlation keys.
 *
 * <p>{@code threads} workers are kept alive; under load the pool hands each task straight to a new worker
 * up to {@code maxThreads}, so a detector stuck past its timeout never holds up the next request. Extra
 * workers retire after a minute idle. Beyond {@code maxThreads} busy workers {@link #execute} throws
 * {@link java.util.concurrent.RejectedExecutionException}.
 */
public final class MdcAwareExecutor implements Executor, AutoCloseable {
    public static final int DEFAULT_MAX_THREADS = 128;

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads) {
        this(threads, Math.max(threads, DEFAULT_MAX_THREADS));
    }

    public MdcAwareExecutor(int threads, int maxThreads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (maxThreads < threads) throw new IllegalArgumentException("maxThreads must be >= threads");
        this.delegate = new ThreadPoolExecutor(
                threads,
                maxThreads,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new NamedDaemonFactory("redactflow4j-detector-"));
    }

    public static MdcAwareExecutor forDetectors() {
        return new MdcAwareExecutor(Math.max(2, Math.min(8, Runtime.getRuntime().availableProcessors())));
    }

    @Override
    public void execute(Runnable command) {
        Objects.requireNonNull(command, "command");
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(2, TimeUnit.SECONDS)) delegate.shutdownNow();
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    private static final class NamedDaemonFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        NamedDaemonFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
