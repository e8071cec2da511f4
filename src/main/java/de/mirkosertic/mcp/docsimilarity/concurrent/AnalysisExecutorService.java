package de.mirkosertic.mcp.docsimilarity.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Worker pool for the data-parallel analysis stages.
 * <p>
 * Work is split into contiguous index ranges, one task per range. Results are joined in index
 * order, so callers always get their output list aligned with their input list no matter in
 * which order the workers ran. Mapper functions must not submit work to this pool themselves.
 */
public class AnalysisExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutorService.class);

    private static final int CHUNKS_PER_THREAD = 4;

    private final ThreadPoolExecutor executor;
    private final int threadCount;

    public AnalysisExecutorService(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1, got " + threadCount);
        }
        this.threadCount = threadCount;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "analysis-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadCount,
                threadCount,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("AnalysisExecutorService initialized with {} threads", threadCount);
    }

    /**
     * Apply {@code mapper} to every item in parallel.
     *
     * @return the mapped values, {@code result.get(i) == mapper.apply(items.get(i))}
     */
    public <T, R> List<R> map(final List<T> items, final Function<? super T, ? extends R> mapper) {
        return mapRange(items.size(), index -> mapper.apply(items.get(index)));
    }

    /**
     * Apply {@code mapper} to every index in {@code [0, size)} in parallel.
     *
     * @return the mapped values in index order
     */
    public <R> List<R> mapRange(final int size, final IntFunction<? extends R> mapper) {
        if (size == 0) {
            return List.of();
        }

        final int chunkCount = Math.min(size, threadCount * CHUNKS_PER_THREAD);
        final int chunkSize = (size + chunkCount - 1) / chunkCount;

        final List<Future<List<R>>> futures = new ArrayList<>(chunkCount);
        for (int start = 0; start < size; start += chunkSize) {
            final int from = start;
            final int to = Math.min(size, start + chunkSize);
            futures.add(executor.submit(() -> {
                final List<R> chunk = new ArrayList<>(to - from);
                for (int i = from; i < to; i++) {
                    chunk.add(mapper.apply(i));
                }
                return chunk;
            }));
        }

        final List<R> results = new ArrayList<>(size);
        for (final Future<List<R>> future : futures) {
            results.addAll(await(future));
        }
        return results;
    }

    private static <V> V await(final Future<V> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for analysis workers");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Analysis worker failed", cause);
        }
    }

    int getThreadCount() {
        return threadCount;
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down AnalysisExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("AnalysisExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for AnalysisExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
