package com.dynop.wayfinding;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a batch of independent tasks on the shared executor and collects their results in task order.
 */
public final class TaskBatches {

    private TaskBatches() {
    }

    /**
     * Submit all tasks, wait for all of them and return their results in submission order.
     *
     * <p>An {@link AnalysisException} thrown by a task is rethrown unchanged; any other failure is wrapped
     * with {@code COMPUTATION_FAILED}. Interruption restores the interrupt flag and raises
     * {@code INTERRUPTED}.
     *
     * @param executorService Worker pool
     * @param tasks           Independent tasks
     * @param label           Phase name used in error messages
     * @return One result per task, in task order
     */
    public static <T> List<T> invokeAll(ExecutorService executorService, List<? extends Callable<T>> tasks,
                                        String label) {
        try {
            List<Future<T>> futures = executorService.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException(AnalysisException.INTERRUPTED, label, "Computation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalysisException) {
                throw (AnalysisException) cause;
            }
            throw new AnalysisException(AnalysisException.COMPUTATION_FAILED, label,
                    "Computation failed: " + cause.getMessage(), cause);
        }
    }
}
