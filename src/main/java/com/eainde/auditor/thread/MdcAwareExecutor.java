package com.eainde.auditor.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool that carries the submitting thread's MDC (run id and friends) onto the
 * worker for the duration of each task.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int poolSize, String threadNamePrefix) {
        this.delegate = Executors.newFixedThreadPool(poolSize, namedThreads(threadNamePrefix));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
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
    public void close() throws InterruptedException {
        delegate.shutdownNow();
        delegate.awaitTermination(10, TimeUnit.SECONDS);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
