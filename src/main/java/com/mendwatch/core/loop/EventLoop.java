package com.mendwatch.core.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded event loop shared by orchestration, task processing and security scans.
 * <p>
 * Work submitted from any thread (agent sampling threads, the file watcher) is queued and run
 * one item at a time on the loop thread. {@link #submit(Callable)} is the bridge: it returns a
 * {@link CompletableFuture} the caller can attach callbacks to without blocking.
 */
public class EventLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public EventLoop() {
        this("mendwatch-loop");
    }

    public EventLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    /**
     * Queues {@code work} on the loop. The returned future completes with its result, or
     * exceptionally if it throws or the loop has been shut down.
     */
    public <T> CompletableFuture<T> submit(Callable<T> work) {
        var future = new CompletableFuture<T>();
        try {
            executor.execute(() -> {
                if (future.isCancelled()) {
                    return;
                }
                try {
                    future.complete(work.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    public CompletableFuture<Void> execute(Runnable work) {
        return submit(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs {@code work} periodically on the loop. Exceptions are logged and do not cancel the
     * schedule.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable work, Duration initialDelay, Duration period) {
        log.info("Scheduling {} every {}ms", name, period.toMillis());
        return executor.scheduleAtFixedRate(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Scheduled job {} failed: {}", name, e.getMessage(), e);
            }
        }, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return !executor.isShutdown();
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Stops accepting work and waits up to {@code timeout} for queued work to finish.
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event loop did not drain within {}ms, forcing shutdown", timeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }
}
