package com.example.packbuilder;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorPipelineTest {
    @Test
    void runsEveryItemBeforeReturning() throws Exception {
        List<Integer> items = IntStream.range(0, 500).boxed().toList();
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        try (ExecutorPipeline pipeline = new ExecutorPipeline(4)) {
            pipeline.forEachParallel(items, item -> item, item -> {
                seen.add(item);
                threads.add(Thread.currentThread().getName());
            });
            assertEquals(500, pipeline.progress());
            assertEquals(500, pipeline.goal());
        }
        assertEquals(500, seen.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("pack-worker-")));
    }

    @Test
    void progressRestartsWithEachBatch() throws Exception {
        try (ExecutorPipeline pipeline = new ExecutorPipeline(2)) {
            pipeline.forEachParallel(List.of("a", "b", "c"), String::length, item -> {
            });
            assertEquals(3, pipeline.progress());
            pipeline.forEachParallel(List.<String>of(), String::length, item -> {
            });
            assertEquals(0, pipeline.progress());
            assertEquals(0, pipeline.goal());
        }
    }

    @Test
    void failureFailsTheBatch() {
        try (ExecutorPipeline pipeline = new ExecutorPipeline(3)) {
            List<Integer> items = IntStream.range(0, 30).boxed().toList();
            PipelineException ex = assertThrows(PipelineException.class, () ->
                    pipeline.forEachParallel(items, item -> 1L, item -> {
                        if (item == 7) {
                            throw new IOException("disk full");
                        }
                    }));
            assertInstanceOf(IOException.class, ex.getCause());
            assertEquals("disk full", ex.getCause().getMessage());
            assertTrue(pipeline.progress() < 30);
        }
    }

    @Test
    void runtimeFailureIsWrapped() {
        try (ExecutorPipeline pipeline = new ExecutorPipeline(1)) {
            PipelineException ex = assertThrows(PipelineException.class, () ->
                    pipeline.forEachParallel(List.of("x"), item -> 0L, item -> {
                        throw new IllegalStateException("generator broke");
                    }));
            assertInstanceOf(IllegalStateException.class, ex.getCause());
        }
    }

    @Test
    void partitionBalancesByWeight() {
        List<Long> weights = List.of(10L, 9L, 8L, 1L, 1L, 1L);
        List<List<Long>> groups = ExecutorPipeline.partition(weights, Long::longValue, 3);

        assertEquals(3, groups.size());
        List<Long> loads = new ArrayList<>();
        for (List<Long> group : groups) {
            loads.add(group.stream().mapToLong(Long::longValue).sum());
        }
        assertEquals(List.of(10L, 10L, 10L), loads);
        assertEquals(6, groups.stream().mapToInt(List::size).sum());
    }

    @Test
    void partitionNeverCreatesEmptyGroups() {
        List<List<String>> groups = ExecutorPipeline.partition(List.of("a", "b"), String::length, 8);
        assertEquals(2, groups.size());
        assertEquals(Set.of("a", "b"), groups.stream().flatMap(List::stream).collect(Collectors.toSet()));
    }

    @Test
    void rejectsNonPositiveThreadCount() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorPipeline(0));
    }
}
