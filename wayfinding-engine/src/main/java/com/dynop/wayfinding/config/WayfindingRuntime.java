package com.dynop.wayfinding.config;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Owns the shared worker pool used by every analysis phase.
 *
 * <p>Workers are daemon threads named {@code wayfinding-worker-N}. Closing the runtime waits up to
 * 30 seconds for running tasks before interrupting them.
 */
public final class WayfindingRuntime implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WayfindingRuntime.class.getName());

    private final ExecutorService executorService;
    private final int poolSize;

    public WayfindingRuntime(WayfindingConfig config) {
        this(Objects.requireNonNull(config, "config").getPoolSize());
    }

    public WayfindingRuntime(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive, was " + poolSize);
        }
        this.poolSize = poolSize;
        AtomicInteger threadCounter = new AtomicInteger(1);
        this.executorService = Executors.newFixedThreadPool(poolSize, r -> {
            Thread thread = new Thread(r, "wayfinding-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.info(() -> "Wayfinding executor started with " + poolSize + " workers");
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public int getPoolSize() {
        return poolSize;
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        LOGGER.info("Wayfinding executor stopped");
    }
}
