package com.traneptora.lightlevel.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import com.traneptora.lightlevel.util.functional.ExceptionalSupplier;
import com.traneptora.lightlevel.util.functional.FunctionalHelper;

/**
 * A group of tasks submitted to a shared pool and joined together.
 * Results come back in submission order, not completion order.
 */
public class TaskList<T> {

    private final List<CompletableFuture<? extends T>> tasks = new ArrayList<>();
    private final ExecutorService threadPool;

    public TaskList(ExecutorService threadPool) {
        this.threadPool = threadPool;
    }

    public void submit(ExceptionalSupplier<? extends T> s) {
        tasks.add(CompletableFuture.supplyAsync(s, threadPool));
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Waits for every submitted task. If any task threw, the remaining tasks
     * are still joined before the first failure is rethrown.
     */
    public List<T> collect() {
        List<T> results = new ArrayList<>(tasks.size());
        Throwable failure = null;
        for (CompletableFuture<? extends T> future : tasks) {
            try {
                results.add(FunctionalHelper.join(future));
            } catch (Throwable ex) {
                if (failure == null)
                    failure = ex;
                else
                    failure.addSuppressed(ex);
            }
        }
        tasks.clear();
        if (failure != null)
            return FunctionalHelper.sneakyThrow(failure);
        return results;
    }
}
