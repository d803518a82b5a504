package com.bubblegrade.util;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Fixed-size pool with a bounded queue that carries the submitting thread's MDC into each task, so
 * worker log lines keep the scan id of the request that scheduled them. Tasks arriving while the
 * queue is full go to {@code whenFull}.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ThreadPoolExecutor delegate;

    public MdcAwareExecutor(String name, int threads, int queueCapacity, RejectedExecutionHandler whenFull) {
        this.delegate = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), namedThreads(name), whenFull);
    }

    /**
     * Throws {@link java.util.concurrent.RejectedExecutionException} when the queue is full.
     */
    public static MdcAwareExecutor rejectingWhenFull(String name, int threads, int queueCapacity) {
        return new MdcAwareExecutor(name, threads, queueCapacity, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs the task in the submitting thread when the queue is full.
     */
    public static MdcAwareExecutor callerRunsWhenFull(String name, int threads, int queueCapacity) {
        return new MdcAwareExecutor(name, threads, queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        delegate.execute(() -> {
            Map<String, String> workerMdc = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                if (workerMdc != null) {
                    MDC.setContextMap(workerMdc);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    @Override
    public void close() throws InterruptedException {
        delegate.shutdown();
        if (!delegate.awaitTermination(30, TimeUnit.SECONDS)) {
            delegate.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
