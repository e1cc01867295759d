package work.lcod.build.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Joins a fan-out of independent tasks at a single barrier.
 */
public final class Futures {
    private Futures() {}

    /**
     * Waits for every task, then returns the results in submission order. The first failure observed is rethrown
     * unwrapped once all tasks have settled.
     */
    public static <T> List<T> joinAll(List<CompletableFuture<T>> tasks) {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException ex) {
            throw unwrap(ex);
        }
        List<T> results = new ArrayList<>(tasks.size());
        for (CompletableFuture<T> task : tasks) {
            results.add(task.join());
        }
        return results;
    }

    private static RuntimeException unwrap(CompletionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }
}
