package org.stianloader.picopip.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    /**
     * Joins the given futures. The returned future fails as soon as any source fails and
     * otherwise completes with the results in source order.
     *
     * @param <T> The result type
     * @param sources The futures to join
     * @return The joined future
     */
    @NotNull
    public static <T> CompletableFuture<List<T>> all(@NotNull List<@NotNull CompletableFuture<T>> sources) {
        return CompletableFuture.allOf(sources.toArray(new CompletableFuture<?>[0])).thenApply((ignore) -> {
            List<T> results = new ArrayList<>(sources.size());
            for (CompletableFuture<T> source : sources) {
                results.add(source.join());
            }
            return results;
        });
    }

    /**
     * Falls back to another future if the main future fails. If the fallback fails as well,
     * the failure of the main future is propagated with the fallback's failure suppressed.
     *
     * @param <T> The result type
     * @param main The main future
     * @param fallback Supplies the fallback future, only invoked if the main future fails
     * @return The future with the fallback configured
     */
    @NotNull
    public static <T> CompletableFuture<T> configureFallback(@NotNull CompletableFuture<T> main, @NotNull Supplier<CompletableFuture<T>> fallback) {
        return main.exceptionallyCompose((t) -> {
            return fallback.get().exceptionally((t2) -> {
                t.addSuppressed(ConcurrencyUtil.unwrap(t2));
                ConcurrencyUtil.sneakyThrow(t);
                throw new InternalError(t);
            });
        });
    }

    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void sneakyThrow(Throwable t) throws T {
        throw (T) t;
    }

    /**
     * Strips the {@link CompletionException} wrappers that {@link CompletableFuture} puts around failures.
     *
     * @param t The failure as observed by a dependent stage
     * @return The underlying failure
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null && !(cause instanceof MultiCompletionException)) {
            cause = cause.getCause();
        }
        return cause;
    }
}
