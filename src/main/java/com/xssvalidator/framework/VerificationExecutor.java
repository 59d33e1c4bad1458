package com.xssvalidator.framework;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Thread pool for calls to the verification service, one task per (match, browser).
 * Uses a bounded queue. A task that cannot be queued (queue full or pool shut down)
 * runs on the submitting thread instead, so a correlated match is never dropped.
 */
public class VerificationExecutor {

    private static final int MAX_QUEUE_SIZE = 1000;

    private final ThreadPoolExecutor executor;
    private final AtomicLong callerRunsCount = new AtomicLong(0);
    private volatile Consumer<String> logger;

    public VerificationExecutor(int threadPoolSize) {
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threadPoolSize, threadPoolSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(MAX_QUEUE_SIZE),
                r -> {
                    Thread t = new Thread(r, "XssValidator-Verify-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                (rejectedTask, pool) -> {
                    long total = callerRunsCount.incrementAndGet();
                    Consumer<String> log = logger;
                    if (log != null) {
                        log.accept("[VerificationExecutor] Pool "
                                + (pool.isShutdown() ? "shut down" : "queue full at " + MAX_QUEUE_SIZE)
                                + ", running verification on caller thread. Total: " + total);
                    }
                    rejectedTask.run();
                }
        );
    }

    /** Sets the logger for warnings (should route to api.logging().logToOutput()). */
    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    /** Number of tasks that ran on the submitting thread because the pool refused them. */
    public long getCallerRunsCount() {
        return callerRunsCount.get();
    }

    public void shutdown() {
        ExecutorService ex = executor;
        ex.shutdown();
        try {
            if (!ex.awaitTermination(5, TimeUnit.SECONDS)) {
                ex.shutdownNow();
            }
        } catch (InterruptedException e) {
            ex.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
