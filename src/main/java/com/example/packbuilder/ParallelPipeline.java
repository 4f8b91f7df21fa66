package com.example.packbuilder;

import java.io.IOException;
import java.util.Collection;
import java.util.function.ToLongFunction;

/**
 * Fans a batch of items out across workers and waits for all of them.
 */
public interface ParallelPipeline {

    /**
     * Runs the action for every item, balanced by weight, and returns once every action finished.
     * The first failing action fails the whole batch.
     */
    <T> void forEachParallel(Collection<T> items, ToLongFunction<? super T> weight, ParallelAction<? super T> action)
            throws IOException, InterruptedException;

    /**
     * Number of items completed in the current batch.
     */
    int progress();

    /**
     * Number of items in the current batch.
     */
    int goal();

    @FunctionalInterface
    interface ParallelAction<T> {
        void accept(T item) throws IOException;
    }
}
