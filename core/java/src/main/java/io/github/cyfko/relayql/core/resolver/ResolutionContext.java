package io.github.cyfko.relayql.core.resolver;

import io.github.cyfko.relayql.core.security.Principal;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Per-operation state shared by the top-level resolution and its nested tasks.
 * <p>
 * Cancelling the context marks it cancelled and cancels every tracked nested task. Persistence calls
 * check the flag first, so no call is issued once the operation is cancelled.
 * </p>
 */
final class ResolutionContext {

    private final Principal principal;
    private final Executor executor;
    private final Set<CompletableFuture<?>> tasks = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    ResolutionContext(Principal principal, Executor executor) {
        this.principal = principal;
        this.executor = executor;
    }

    Principal principal() {
        return principal;
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if the operation was cancelled
     */
    void checkNotCancelled() {
        if (cancelled) {
            throw new CancellationException("Resolution cancelled");
        }
    }

    /**
     * Runs a nested task on the configured executor and tracks it for cancellation.
     */
    <T> CompletableFuture<T> supplyAsync(Supplier<T> task) {
        checkNotCancelled();
        return track(CompletableFuture.supplyAsync(() -> {
            checkNotCancelled();
            return task.get();
        }, executor));
    }

    <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        tasks.add(future);
        future.whenComplete((value, error) -> tasks.remove(future));
        if (cancelled) {
            future.cancel(true);
        }
        return future;
    }

    void cancel() {
        cancelled = true;
        for (CompletableFuture<?> task : tasks) {
            task.cancel(true);
        }
    }
}
