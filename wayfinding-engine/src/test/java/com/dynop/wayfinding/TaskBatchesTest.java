package com.dynop.wayfinding;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskBatchesTest {

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void resultsComeBackInTaskOrder() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                final int value = i;
                tasks.add(() -> {
                    Thread.sleep((50 - value) % 5);
                    return value * value;
                });
            }

            List<Integer> results = TaskBatches.invokeAll(executor, tasks, "squares");

            for (int i = 0; i < 50; i++) {
                assertEquals(i * i, results.get(i));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void interruptionRestoresFlagAndRaisesInterrupted() throws Exception {
        ExecutorService executor = mock(ExecutorService.class);
        when(executor.invokeAll(ArgumentMatchers.<Collection<Callable<Integer>>>any()))
                .thenThrow(new InterruptedException("stop"));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> TaskBatches.invokeAll(executor, List.<Callable<Integer>>of(() -> 1), "isovists"));

        assertEquals(AnalysisException.INTERRUPTED, ex.getErrorCode());
        assertEquals("isovists", ex.getEntityId());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void taskFailureIsWrappedWithCause() throws Exception {
        ExecutorService executor = mock(ExecutorService.class);
        IllegalStateException failure = new IllegalStateException("boom");
        when(executor.invokeAll(ArgumentMatchers.<Collection<Callable<Integer>>>any()))
                .thenAnswer(invocation -> {
                    List<Future<Integer>> futures = new ArrayList<>();
                    futures.add(CompletableFuture.completedFuture(1));
                    futures.add(CompletableFuture.failedFuture(failure));
                    return futures;
                });

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> TaskBatches.invokeAll(executor, List.<Callable<Integer>>of(() -> 1, () -> 2), "space-syntax"));

        assertEquals(AnalysisException.COMPUTATION_FAILED, ex.getErrorCode());
        assertSame(failure, ex.getCause());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void analysisFailureInTaskIsRethrownUnchanged() throws Exception {
        ExecutorService executor = mock(ExecutorService.class);
        AnalysisException failure = new AnalysisException(AnalysisException.UNKNOWN_NODE, "Q", "missing");
        when(executor.invokeAll(ArgumentMatchers.<Collection<Callable<Integer>>>any()))
                .thenAnswer(invocation -> List.of(CompletableFuture.<Integer>failedFuture(failure)));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> TaskBatches.invokeAll(executor, List.<Callable<Integer>>of(() -> 1), "simulation:lobby"));

        assertSame(failure, ex);
    }

    @Test
    void messageNamesEntity() {
        AnalysisException ex = new AnalysisException(AnalysisException.INVALID_EDGE, "A-B", "Self loops are not allowed");

        assertEquals("INVALID_EDGE: Self loops are not allowed [A-B]", ex.getMessage());
        assertEquals("EMPTY_GRAPH: no nodes",
                new AnalysisException(AnalysisException.EMPTY_GRAPH, null, "no nodes").getMessage());
    }
}
