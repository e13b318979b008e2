package de.mirkosertic.talentmatch.semantic;

import de.mirkosertic.talentmatch.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for similarity provider calls.
 * Limits how many provider requests are in flight at the same time. When the
 * queue is full, further calls are rejected with a
 * {@link java.util.concurrent.RejectedExecutionException}; a provider call never
 * runs on the submitting thread, where no timeout could bound it.
 */
public class SimilarityExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityExecutorService.class);

    static final int QUEUE_CAPACITY = 10000;

    private final ThreadPoolExecutor executor;

    public SimilarityExecutorService(final ApplicationConfig config) {
        this(config.getThreadPoolSize());
    }

    public SimilarityExecutorService(final int threads) {
        this(threads, QUEUE_CAPACITY);
    }

    public SimilarityExecutorService(final int threads, final int queueCapacity) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread pool size must be positive: " + threads);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "similarity-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );

        logger.info("SimilarityExecutorService initialized with {} threads, queue capacity {}", threads, queueCapacity);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down SimilarityExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("SimilarityExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SimilarityExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int getPoolSize() {
        return executor.getMaximumPoolSize();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }
}
