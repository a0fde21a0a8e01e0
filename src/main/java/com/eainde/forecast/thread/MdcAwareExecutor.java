package com.eainde.forecast.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed thread pool that carries the submitting thread's MDC (and so the {@code runId})
 * into every task it runs.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    public static MdcAwareExecutor fixed(String name, int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, factory));
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command));
    }

    public <T> Future<T> submit(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return delegate.submit(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(parentMdc);
            try {
                return task.call();
            } finally {
                apply(previous);
            }
        });
    }

    private static Runnable wrap(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(parentMdc);
            try {
                command.run();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    @Override
    public void close() {
        delegate.shutdownNow();
        try {
            delegate.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
