package com.example.packbuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToLongFunction;

/**
 * {@link ParallelPipeline} backed by a fixed thread pool. Items are split into one group per
 * worker, heaviest first, each going to the group with the least accumulated weight.
 * Batches run one at a time.
 */
public final class ExecutorPipeline implements ParallelPipeline, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorPipeline.class);

    private final int threadCount;
    private final ExecutorService executor;
    private final AtomicInteger progress = new AtomicInteger();
    private volatile int goal;

    public ExecutorPipeline(int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        this.threadCount = threadCount;
        this.executor = Executors.newFixedThreadPool(threadCount, workerFactory());
    }

    @Override
    public synchronized <T> void forEachParallel(Collection<T> items,
                                                 ToLongFunction<? super T> weight,
                                                 ParallelAction<? super T> action) throws PipelineException, InterruptedException {
        progress.set(0);
        goal = items.size();
        if (items.isEmpty()) {
            return;
        }
        AtomicBoolean failed = new AtomicBoolean();
        List<Future<?>> futures = new ArrayList<>();
        for (List<T> group : partition(items, weight, threadCount)) {
            futures.add(executor.submit(() -> {
                for (T item : group) {
                    if (failed.get()) {
                        return null;
                    }
                    try {
                        action.accept(item);
                    } catch (Exception | Error ex) {
                        failed.set(true);
                        throw ex;
                    }
                    progress.incrementAndGet();
                }
                return null;
            }));
        }
        // Wait for every group, even after a failure, so no worker still writes once we return.
        Throwable failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                if (failure == null) {
                    failure = ex.getCause();
                } else {
                    failure.addSuppressed(ex.getCause());
                }
            } catch (InterruptedException ex) {
                failed.set(true);
                futures.forEach(f -> f.cancel(true));
                throw ex;
            }
        }
        if (failure != null) {
            throw new PipelineException("Parallel batch failed after " + progress.get() + "/" + goal + " items", failure);
        }
    }

    @Override
    public int progress() {
        return progress.get();
    }

    @Override
    public int goal() {
        return goal;
    }

    public int threadCount() {
        return threadCount;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOGGER.warn("Worker pool did not stop in time; forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /**
     * Longest-weight-first greedy split of the items into at most {@code groups} groups.
     */
    static <T> List<List<T>> partition(Collection<T> items, ToLongFunction<? super T> weight, int groups) {
        int count = Math.min(groups, items.size());
        List<List<T>> result = new ArrayList<>(count);
        long[] loads = new long[count];
        for (int i = 0; i < count; i++) {
            result.add(new ArrayList<>());
        }
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingLong((T item) -> weight.applyAsLong(item)).reversed());
        for (T item : sorted) {
            int lightest = 0;
            for (int i = 1; i < count; i++) {
                if (loads[i] < loads[lightest]) {
                    lightest = i;
                }
            }
            result.get(lightest).add(item);
            loads[lightest] += Math.max(0L, weight.applyAsLong(item));
        }
        return result;
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pack-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
